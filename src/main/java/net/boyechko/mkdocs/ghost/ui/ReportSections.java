/*
 * MkDocs-Ghost - Navigation and Link Auditing for MkDocs Documentation Trees
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.mkdocs.ghost.ui;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import net.boyechko.mkdocs.ghost.core.AuditResult;
import net.boyechko.mkdocs.ghost.finding.BrokenImage;
import net.boyechko.mkdocs.ghost.finding.BrokenLink;
import net.boyechko.mkdocs.ghost.finding.FindingType;

/** Turns an {@link AuditResult} into display lines, one section per finding type. */
public final class ReportSections {
    static final String HELP_MARKER = "[H] ";
    static final String ARROW = " -> ";

    private ReportSections() {}

    public record Section(FindingType type, List<String> lines) {
        public Section {
            lines = List.copyOf(lines);
        }

        public String title() {
            return type.groupLabel();
        }
    }

    /** Every type that counts as an issue. Footnotes must be asked for. */
    public static Set<FindingType> defaultSelection() {
        Set<FindingType> types = EnumSet.noneOf(FindingType.class);
        for (FindingType type : FindingType.values()) {
            if (type.isIssue()) {
                types.add(type);
            }
        }
        return types;
    }

    /**
     * Builds the selected sections in declaration order. Paths are shown relative to {@code root}
     * when they lie under it.
     */
    public static List<Section> build(AuditResult result, Path root, Set<FindingType> selected) {
        List<Section> sections = new ArrayList<>();
        for (FindingType type : FindingType.values()) {
            if (selected.contains(type)) {
                sections.add(new Section(type, lines(result, root, type)));
            }
        }
        return sections;
    }

    /** Findings across the issue sections; informational sections do not count. */
    public static int issueCount(List<Section> sections) {
        int total = 0;
        for (Section section : sections) {
            if (section.type().isIssue()) {
                total += section.lines().size();
            }
        }
        return total;
    }

    static List<String> lines(AuditResult result, Path root, FindingType type) {
        return switch (type) {
            case NAV_MISSING -> paths(result.navMissing(), root);
            case GHOST -> paths(result.ghost(), root);
            case HELP_MISSING -> paths(result.helpMissing(), root);
            case BROKEN_LINK ->
                    result.brokenLinks().stream().map(b -> brokenLink(b, root)).toList();
            case MISSING_IMAGE ->
                    result.missingImages().stream().map(b -> brokenImage(b, root)).toList();
            case ORPHAN_IMAGE -> paths(result.orphanImages(), root);
            case FOOTNOTES -> paths(result.pagesWithFootnotes(), root);
        };
    }

    static String brokenLink(BrokenLink link, Path root) {
        String marker = link.fromHelpUrl() ? HELP_MARKER : "";
        return marker + display(link.from(), root) + ARROW + link.link();
    }

    static String brokenImage(BrokenImage image, Path root) {
        return display(image.from(), root) + ARROW + image.image();
    }

    private static List<String> paths(List<Path> paths, Path root) {
        return paths.stream().map(p -> display(p, root)).toList();
    }

    /** Slash-separated on every platform. */
    public static String display(Path path, Path root) {
        Path shown = root != null && path.startsWith(root) ? root.relativize(path) : path;
        return shown.toString().replace('\\', '/');
    }
}

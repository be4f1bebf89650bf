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
package net.boyechko.mkdocs.ghost.core;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import net.boyechko.mkdocs.ghost.finding.BrokenImage;
import net.boyechko.mkdocs.ghost.finding.BrokenLink;
import net.boyechko.mkdocs.ghost.finding.FindingType;

/** Everything one audit found. All lists are sorted. */
public record AuditResult(
        List<Path> navMissing,
        List<Path> ghost,
        List<Path> helpMissing,
        List<BrokenLink> brokenLinks,
        List<BrokenImage> missingImages,
        List<Path> orphanImages,
        List<Path> pagesWithFootnotes) {

    public AuditResult {
        navMissing = List.copyOf(navMissing);
        ghost = List.copyOf(ghost);
        helpMissing = List.copyOf(helpMissing);
        brokenLinks = List.copyOf(brokenLinks);
        missingImages = List.copyOf(missingImages);
        orphanImages = List.copyOf(orphanImages);
        pagesWithFootnotes = List.copyOf(pagesWithFootnotes);
    }

    public int count(FindingType type) {
        return switch (type) {
            case NAV_MISSING -> navMissing.size();
            case GHOST -> ghost.size();
            case HELP_MISSING -> helpMissing.size();
            case BROKEN_LINK -> brokenLinks.size();
            case MISSING_IMAGE -> missingImages.size();
            case ORPHAN_IMAGE -> orphanImages.size();
            case FOOTNOTES -> pagesWithFootnotes.size();
        };
    }

    /** Issues across every type except the informational ones. */
    public int totalIssues() {
        int total = 0;
        for (FindingType type : FindingType.values()) {
            if (type.isIssue()) {
                total += count(type);
            }
        }
        return total;
    }

    public boolean hasIssues() {
        return totalIssues() > 0;
    }

    /**
     * Drops findings located in the named subsites. A path's subsite is its first segment
     * relative to {@code root}; paths outside {@code root} are kept.
     */
    public AuditResult excludingSubsites(Path root, Set<String> subsites) {
        if (subsites.isEmpty()) {
            return this;
        }
        Predicate<Path> keep = path -> !subsites.contains(subsiteOf(root, path));
        return new AuditResult(
                navMissing.stream().filter(keep).toList(),
                ghost.stream().filter(keep).toList(),
                helpMissing.stream().filter(keep).toList(),
                brokenLinks.stream().filter(b -> keep.test(b.from())).toList(),
                missingImages.stream().filter(b -> keep.test(b.from())).toList(),
                orphanImages.stream().filter(keep).toList(),
                pagesWithFootnotes.stream().filter(keep).toList());
    }

    static String subsiteOf(Path root, Path path) {
        if (!path.startsWith(root) || path.equals(root)) {
            return "";
        }
        return root.relativize(path).getName(0).toString();
    }
}

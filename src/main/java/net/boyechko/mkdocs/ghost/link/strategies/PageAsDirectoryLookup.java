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
package net.boyechko.mkdocs.ghost.link.strategies;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.mkdocs.ghost.link.PathNormalizer;
import net.boyechko.mkdocs.ghost.link.ResolutionContext;
import net.boyechko.mkdocs.ghost.link.ResolutionStrategy;

/**
 * Resolves the link in the URL space MkDocs serves, where {@code dir/page.md} is served at
 * {@code dir/page/}. A relative link is tried first against the page URL itself (how a browser
 * resolves it) and then against its parent (how the filesystem would). The resulting URL is
 * mapped back to disk, crossing into another subsite when its first segment names one.
 *
 * <p>The source URL is derived from the filesystem: the subsite directory name followed by the
 * path inside its {@code docs} folder.
 */
public class PageAsDirectoryLookup implements ResolutionStrategy {

    @Override
    public String name() {
        return "page-as-directory";
    }

    @Override
    public Optional<Path> resolve(Path source, String link, ResolutionContext ctx) {
        for (Path candidate : candidates(source, link, ctx.monorepoRoot())) {
            Optional<Path> hit = ctx.existing(candidate);
            if (hit.isPresent()) {
                return hit;
            }
        }
        return Optional.empty();
    }

    static List<Path> candidates(Path source, String link, Path monorepoRoot) {
        List<Path> candidates = new ArrayList<>();
        Optional<Path> docsDir = ResolutionContext.docsDirFor(source);
        if (docsDir.isEmpty()
                || docsDir.get().getParent() == null
                || docsDir.get().getParent().getFileName() == null) {
            return candidates;
        }
        Path docs = docsDir.get();
        String subsite = docs.getParent().getFileName().toString();
        String withinDocs = PathNormalizer.toUrl(docs.relativize(source));
        String sourceUrl = PathNormalizer.stripExtension(PathNormalizer.joinUrl(subsite, withinDocs));
        String linkUrl = PathNormalizer.stripExtension(link);

        if (link.startsWith("/")) {
            String url = PathNormalizer.normalizeUrl(PathNormalizer.stripLeadingSlashes(linkUrl));
            if (!url.isEmpty()) {
                candidates.add(toFilesystem(url, subsite, docs, monorepoRoot));
            }
            return candidates;
        }

        for (String base : List.of(sourceUrl, PathNormalizer.parentUrl(sourceUrl))) {
            String url = PathNormalizer.normalizeUrl(PathNormalizer.joinUrl(base, linkUrl));
            if (url.isEmpty()) {
                continue;
            }
            Path path = toFilesystem(url, subsite, docs, monorepoRoot);
            if (!candidates.contains(path)) {
                candidates.add(path);
            }
        }
        return candidates;
    }

    /**
     * A URL whose first segment names another subsite (a sibling directory with its own
     * {@code docs}) maps into that subsite's {@code docs}; anything else stays in the current
     * one.
     */
    static Path toFilesystem(String url, String subsite, Path docsDir, Path monorepoRoot) {
        int slash = url.indexOf('/');
        String first = slash < 0 ? url : url.substring(0, slash);
        String rest = slash < 0 ? "" : url.substring(slash + 1);

        Path otherDocs = monorepoRoot.resolve(first).resolve(ResolutionContext.DOCS_DIR);
        Path target;
        if (!first.equals(subsite) && Files.isDirectory(otherDocs)) {
            target = rest.isEmpty() ? otherDocs : PathNormalizer.join(otherDocs, rest);
        } else {
            String prefix = subsite + "/";
            String within = url.startsWith(prefix) ? url.substring(prefix.length()) : url;
            target = PathNormalizer.join(docsDir, within);
        }
        return PathNormalizer.normalize(target.resolveSibling(target.getFileName() + ".md"));
    }
}

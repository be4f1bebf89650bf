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
package net.boyechko.mkdocs.ghost.link;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Everything a {@link ResolutionStrategy} may consult. Read-only for the whole audit.
 *
 * @param linkMaps rendered URL maps built from the nav tree
 * @param monorepoRoot directory holding the top-level nav config
 * @param includeRoots directories of the included subsites
 * @param markdownFiles every markdown file found under the include roots
 */
public record ResolutionContext(
        LinkMaps linkMaps, Path monorepoRoot, List<Path> includeRoots, Set<Path> markdownFiles) {
    public static final String DOCS_DIR = "docs";
    private static final String INDEX_PAGE = "index.md";

    public ResolutionContext {
        includeRoots = List.copyOf(includeRoots);
        markdownFiles = Set.copyOf(markdownFiles);
    }

    /**
     * Accepts {@code candidate} if it is a file on disk or a known markdown file, and otherwise
     * tries {@code <candidate without extension>/index.md} the same way.
     */
    public Optional<Path> existing(Path candidate) {
        Path normalized = PathNormalizer.normalize(candidate);
        if (isKnownFile(normalized)) {
            return Optional.of(normalized);
        }
        String name = normalized.getFileName() == null ? "" : normalized.getFileName().toString();
        Path stem = normalized.resolveSibling(PathNormalizer.stripExtension(name));
        Path index = stem.resolve(INDEX_PAGE);
        return isKnownFile(index) ? Optional.of(index) : Optional.empty();
    }

    private boolean isKnownFile(Path path) {
        return markdownFiles.contains(path) || Files.isRegularFile(path);
    }

    /**
     * The rendered URL a link from {@code source} points at, computed against the source's own
     * rendered URL. Empty when the source is not in the nav.
     */
    public Optional<String> renderedUrlFor(Path source, String link) {
        return linkMaps.urlFor(source).map(fromUrl -> renderedUrl(fromUrl, link));
    }

    static String renderedUrl(String fromUrl, String link) {
        String joined =
                link.startsWith("/")
                        ? PathNormalizer.stripLeadingSlashes(link)
                        : PathNormalizer.joinUrl(PathNormalizer.parentUrl(fromUrl), link);
        return PathNormalizer.normalizeUrl(PathNormalizer.stripExtension(joined));
    }

    /**
     * The site directory owning {@code path}: the parent of its nearest ancestor named
     * {@code docs}.
     */
    public static Optional<Path> docsRootFor(Path path) {
        return docsDirFor(path).map(Path::getParent);
    }

    /** The nearest ancestor of {@code path} named {@code docs}, if any. */
    public static Optional<Path> docsDirFor(Path path) {
        for (Path p = path; p != null; p = p.getParent()) {
            Path name = p.getFileName();
            if (name != null && name.toString().equals(DOCS_DIR)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}

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
package net.boyechko.mkdocs.ghost.image;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import net.boyechko.mkdocs.ghost.link.PathNormalizer;
import net.boyechko.mkdocs.ghost.link.ResolutionContext;

/**
 * Places an image reference on disk.
 *
 * <p>Absolute references ({@code /img/x.png}) are tried under each include root's {@code docs}
 * folder, or the root itself when it has none, and must name a known image. Relative references
 * are tried next to the referencing file, where any regular file counts, and then under each
 * include root's {@code docs} folder.
 */
public class ImageResolver {
    private final Set<Path> allImages;
    private final List<Path> includeRoots;

    public ImageResolver(Set<Path> allImages, List<Path> includeRoots) {
        this.allImages = Set.copyOf(allImages);
        this.includeRoots = List.copyOf(includeRoots);
    }

    public Optional<Path> resolve(Path source, String ref) {
        if (ref.startsWith("/")) {
            for (Path root : includeRoots) {
                Path docs = root.resolve(ResolutionContext.DOCS_DIR);
                Path base = Files.exists(docs) ? docs : root;
                Path candidate = PathNormalizer.join(base, ref.substring(1));
                if (allImages.contains(candidate)) {
                    return Optional.of(candidate);
                }
            }
            return Optional.empty();
        }

        Path parent = source.getParent();
        if (parent != null) {
            Path candidate = PathNormalizer.normalize(parent.resolve(ref));
            if (allImages.contains(candidate) || Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }

        for (Path root : includeRoots) {
            Path docs = root.resolve(ResolutionContext.DOCS_DIR);
            if (Files.exists(docs)) {
                Path candidate = PathNormalizer.normalize(docs.resolve(ref));
                if (allImages.contains(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }
}

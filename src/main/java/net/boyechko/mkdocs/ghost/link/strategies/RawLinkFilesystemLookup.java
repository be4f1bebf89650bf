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

import java.nio.file.Path;
import java.util.Optional;
import net.boyechko.mkdocs.ghost.link.PathNormalizer;
import net.boyechko.mkdocs.ghost.link.ResolutionContext;
import net.boyechko.mkdocs.ghost.link.ResolutionStrategy;

/**
 * Reads the link as a plain filesystem path: absolute links are rooted at the source site's
 * {@code docs} folder, relative ones at the source's directory.
 */
public class RawLinkFilesystemLookup implements ResolutionStrategy {

    @Override
    public String name() {
        return "filesystem";
    }

    @Override
    public Optional<Path> resolve(Path source, String link, ResolutionContext ctx) {
        if (link.startsWith("/")) {
            return ResolutionContext.docsRootFor(source)
                    .map(root -> root.resolve(ResolutionContext.DOCS_DIR))
                    .map(docs -> PathNormalizer.join(docs, link))
                    .flatMap(ctx::existing);
        }
        Path parent = source.getParent();
        return parent == null
                ? Optional.empty()
                : ctx.existing(PathNormalizer.join(parent, link));
    }
}

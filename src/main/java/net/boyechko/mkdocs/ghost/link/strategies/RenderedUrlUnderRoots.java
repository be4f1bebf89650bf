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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.mkdocs.ghost.link.PathNormalizer;
import net.boyechko.mkdocs.ghost.link.ResolutionContext;
import net.boyechko.mkdocs.ghost.link.ResolutionStrategy;

/**
 * Treats the link's rendered URL as a path inside a {@code docs} folder: first the source's own
 * site, then every include root in order.
 */
public class RenderedUrlUnderRoots implements ResolutionStrategy {

    @Override
    public String name() {
        return "rendered-url";
    }

    @Override
    public Optional<Path> resolve(Path source, String link, ResolutionContext ctx) {
        Optional<String> rendered = ctx.renderedUrlFor(source, link);
        if (rendered.isEmpty()) {
            return Optional.empty();
        }

        List<Path> roots = new ArrayList<>();
        ResolutionContext.docsRootFor(source).ifPresent(roots::add);
        roots.addAll(ctx.includeRoots());

        for (Path root : roots) {
            Path candidate =
                    PathNormalizer.join(
                            root.resolve(ResolutionContext.DOCS_DIR), rendered.get() + ".md");
            Optional<Path> hit = ctx.existing(candidate);
            if (hit.isPresent()) {
                return hit;
            }
        }
        return Optional.empty();
    }
}

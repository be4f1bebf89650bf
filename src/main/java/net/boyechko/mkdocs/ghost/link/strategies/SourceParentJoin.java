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
import net.boyechko.mkdocs.ghost.link.ResolutionContext;
import net.boyechko.mkdocs.ghost.link.ResolutionStrategy;

/** Last resort: the link text appended to the source's directory, with no interpretation. */
public class SourceParentJoin implements ResolutionStrategy {

    @Override
    public String name() {
        return "parent";
    }

    @Override
    public Optional<Path> resolve(Path source, String link, ResolutionContext ctx) {
        Path parent = source.getParent();
        if (parent == null) {
            return Optional.empty();
        }
        // Path.resolve treats a leading slash as absolute, which is what a raw join does.
        return ctx.existing(parent.resolve(link));
    }
}

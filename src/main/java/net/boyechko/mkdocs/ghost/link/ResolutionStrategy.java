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

import java.nio.file.Path;
import java.util.Optional;

/**
 * One way of mapping a normalized link back to a markdown file. Strategies are tried in order by
 * {@link LinkResolver}; the first one returning a target wins.
 */
public interface ResolutionStrategy {

    /** Short name used in debug logging. */
    String name();

    /**
     * @param source the page containing the link
     * @param link the link after {@link LinkNormalizer}, always ending in {@code .md}
     * @return the existing target file, or empty when this strategy cannot place the link
     */
    Optional<Path> resolve(Path source, String link, ResolutionContext ctx);
}

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
package net.boyechko.mkdocs.ghost.finding;

import java.nio.file.Path;
import java.util.Comparator;

/**
 * A link no resolution strategy could place.
 *
 * @param from the page containing the link
 * @param link the link after normalization
 * @param fromHelpUrl whether {@code from} was named by the help index
 */
public record BrokenLink(Path from, String link, boolean fromHelpUrl) {
    public static final Comparator<BrokenLink> ORDER =
            Comparator.comparing(BrokenLink::from).thenComparing(BrokenLink::link);
}

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
 * An image reference in a markdown page that points at no known image.
 *
 * @param from the page containing the reference
 * @param image the reference as written
 */
public record BrokenImage(Path from, String image) {
    public static final Comparator<BrokenImage> ORDER =
            Comparator.comparing(BrokenImage::from).thenComparing(BrokenImage::image);
}

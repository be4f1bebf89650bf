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
package net.boyechko.mkdocs.ghost.scan;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/** Finds markdown files that neither the nav nor any followed link reaches. */
public final class OrphanDetector {
    static final String PRINT_SUFFIX = "-print.md";

    private OrphanDetector() {}

    /** Sorted. Print variants ({@code *-print.md}) are never orphans. */
    public static List<Path> ghosts(
            Collection<Path> files, Set<Path> navPages, Set<Path> referenced) {
        return files.stream()
                .filter(file -> !navPages.contains(file))
                .filter(file -> !referenced.contains(file))
                .filter(file -> !isPrintVariant(file))
                .sorted()
                .toList();
    }

    static boolean isPrintVariant(Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().endsWith(PRINT_SUFFIX);
    }
}

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
package net.boyechko.mkdocs.ghost.nav;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import net.boyechko.mkdocs.ghost.link.PathNormalizer;

/** Derives filesystem facts from a loaded {@link NavTree}, without touching the filesystem. */
public final class PageCollector {
    static final String DOCS_DIR = "docs";

    private PageCollector() {}

    /**
     * Returns the path every nav leaf should occupy, {@code <site>/docs/<path>}, across all
     * included subsites. Whether those paths exist is left to the caller.
     */
    public static Set<Path> collectPages(NavTree tree) {
        Set<Path> pages = new LinkedHashSet<>();
        collectPages(tree, tree.items(), pages);
        return pages;
    }

    private static void collectPages(NavTree tree, List<NavItem> items, Set<Path> pages) {
        for (NavItem item : items) {
            if (item instanceof NavItem.Page page) {
                if (page.includeTarget().isPresent()) {
                    NavTree child = tree.include(page.includeTarget().get());
                    collectPages(child, child.items(), pages);
                } else {
                    pages.add(pagePath(tree.directory(), page.target()));
                }
            } else if (item instanceof NavItem.Section section) {
                collectPages(tree, section.children(), pages);
            } else if (item instanceof NavItem.PlainPath plain) {
                pages.add(pagePath(tree.directory(), plain.target()));
            }
        }
    }

    /**
     * Returns the directories that host each included config's docs tree. Only includes named by
     * the top-level config count; the top-level directory itself is never a root, so walking these
     * never crosses into the monorepo root.
     */
    public static List<Path> includeRoots(NavTree tree) {
        Set<Path> roots = new TreeSet<>();
        for (String target : NavTreeLoader.includeTargets(tree.items())) {
            Path includeFile = PathNormalizer.join(tree.directory(), target);
            Path parent = includeFile.getParent();
            if (parent != null) {
                roots.add(parent);
            }
        }
        return List.copyOf(roots);
    }

    /** {@code <siteDir>/docs/<navPath>}, normalized. */
    public static Path pagePath(Path siteDir, String navPath) {
        return PathNormalizer.join(siteDir.resolve(DOCS_DIR), navPath);
    }
}

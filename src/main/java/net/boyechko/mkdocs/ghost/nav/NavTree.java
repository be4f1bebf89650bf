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
import java.util.List;
import java.util.Map;

/**
 * A decoded nav config with every include directive already loaded.
 *
 * @param configFile absolute, normalized path of the {@code mkdocs.yml} this tree came from
 * @param items the top-level nav entries, in file order
 * @param includes the trees loaded for each include target, keyed by the target as written
 */
public record NavTree(Path configFile, List<NavItem> items, Map<String, NavTree> includes) {
    public NavTree {
        items = List.copyOf(items);
        includes = Map.copyOf(includes);
    }

    /** The site directory: holds the config file and its {@code docs/} folder. */
    public Path directory() {
        return configFile.getParent();
    }

    /** Returns the tree loaded for an include target. */
    public NavTree include(String target) {
        NavTree child = includes.get(target);
        if (child == null) {
            throw new IllegalStateException(
                    "Include '" + target + "' of " + configFile + " was not loaded");
        }
        return child;
    }
}

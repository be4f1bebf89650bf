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

import java.util.List;
import java.util.Optional;

/** One entry of an MkDocs {@code nav} list. */
public sealed interface NavItem {

    /** {@code - Title: path.md}, or {@code - Title: !include sub/mkdocs.yml}. */
    record Page(String title, String target) implements NavItem {
        /** The included config path when this page is an include directive. */
        public Optional<String> includeTarget() {
            return IncludeDirective.parse(target);
        }
    }

    /** {@code - Title:} followed by a nested list. */
    record Section(String title, List<NavItem> children) implements NavItem {
        public Section {
            children = List.copyOf(children);
        }
    }

    /** A bare {@code - path.md}. */
    record PlainPath(String target) implements NavItem {}

    static NavItem page(String title, String target) {
        return new Page(title, target);
    }

    static NavItem section(String title, List<NavItem> children) {
        return new Section(title, children);
    }

    static NavItem plainPath(String target) {
        return new PlainPath(target);
    }
}

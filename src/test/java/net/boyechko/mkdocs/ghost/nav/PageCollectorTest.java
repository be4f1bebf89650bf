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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.mkdocs.ghost.DocTreeTestBase;
import net.boyechko.mkdocs.ghost.core.AuditException;
import org.junit.jupiter.api.Test;

class PageCollectorTest extends DocTreeTestBase {

    private static NavTree tree(Path dir, NavItem... items) {
        return new NavTree(dir.resolve("mkdocs.yml"), List.of(items), Map.of());
    }

    @Test
    void pageEntryLivesUnderDocs() {
        Path dir = Path.of("/repo");
        Set<Path> pages = PageCollector.collectPages(tree(dir, NavItem.page("Home", "index.md")));
        assertEquals(Set.of(Path.of("/repo/docs/index.md")), pages);
    }

    @Test
    void plainPathIsNormalized() {
        Path dir = Path.of("/repo");
        Set<Path> pages = PageCollector.collectPages(tree(dir, NavItem.plainPath("./guide/../a.md")));
        assertEquals(Set.of(Path.of("/repo/docs/a.md")), pages);
    }

    @Test
    void nestedSectionsContributeTheirLeaves() {
        Path dir = Path.of("/repo");
        NavTree nav =
                tree(
                        dir,
                        NavItem.section(
                                "Outer",
                                List.of(
                                        NavItem.page("A", "a.md"),
                                        NavItem.section(
                                                "Inner", List.of(NavItem.plainPath("x/b.md"))))),
                        NavItem.page("C", "c.md"));

        assertEquals(
                Set.of(
                        Path.of("/repo/docs/a.md"),
                        Path.of("/repo/docs/x/b.md"),
                        Path.of("/repo/docs/c.md")),
                PageCollector.collectPages(nav));
    }

    @Test
    void emptyNavHasNoPages() {
        assertTrue(PageCollector.collectPages(tree(Path.of("/repo"))).isEmpty());
    }

    @Test
    void includedPagesAreRootedAtTheIncludedSite() throws AuditException {
        writeNav("sub", "- Page: page.md");
        Path config = writeNav("", "- Home: index.md", "- Sub: !include sub/mkdocs.yml");

        NavTree nav = new NavTreeLoader().load(config);

        assertEquals(
                Set.of(path("docs/index.md"), path("sub/docs/page.md")),
                PageCollector.collectPages(nav));
    }

    @Test
    void includeRootsAreTopLevelIncludeDirectoriesOnly() throws AuditException {
        writeNav("b/nested", "- N: n.md");
        writeNav("b", "- Nested: !include nested/mkdocs.yml");
        writeNav("a", "- A: a.md");
        Path config =
                writeNav(
                        "",
                        "- B: !include b/mkdocs.yml",
                        "- Section:",
                        "    - A: !include a/mkdocs.yml",
                        "    - Again: !include ./a/mkdocs.yml");

        NavTree nav = new NavTreeLoader().load(config);

        assertEquals(List.of(path("a"), path("b")), PageCollector.includeRoots(nav));
    }

    @Test
    void siteWithoutIncludesHasNoRoots() {
        assertTrue(PageCollector.includeRoots(tree(Path.of("/repo"), NavItem.page("A", "a.md"))).isEmpty());
    }
}

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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.boyechko.mkdocs.ghost.DocTreeTestBase;
import net.boyechko.mkdocs.ghost.link.LinkMaps;
import net.boyechko.mkdocs.ghost.link.ResolutionContext;
import org.junit.jupiter.api.Test;

class ResolutionStrategiesTest extends DocTreeTestBase {

    private ResolutionContext context(Map<String, Path> urls, List<Path> includeRoots) {
        Map<Path, String> inverse = new LinkedHashMap<>();
        urls.forEach((url, src) -> inverse.putIfAbsent(src, url));
        return new ResolutionContext(new LinkMaps(urls, inverse), root(), includeRoots, Set.of());
    }

    @Test
    void navLookupResolvesSiblingInRenderedUrlSpace() {
        Path a = touch("docs/guide/a.md");
        Path b = touch("docs/guide/b.md");
        ResolutionContext ctx = context(Map.of("guide/a", a, "guide/b", b), List.of());

        assertEquals(Optional.of(b), new NavUrlLookup().resolve(a, "b.md", ctx));
        assertEquals(Optional.of(b), new NavUrlLookup().resolve(a, "/guide/b.md", ctx));
    }

    @Test
    void navLookupRejectsMapHitsMissingOnDisk() {
        Path a = touch("docs/a.md");
        ResolutionContext ctx = context(Map.of("a", a, "gone", path("docs/gone.md")), List.of());

        assertEquals(Optional.empty(), new NavUrlLookup().resolve(a, "gone.md", ctx));
    }

    @Test
    void navLookupNeedsSourceInNav() {
        Path orphan = touch("docs/orphan.md");
        touch("docs/b.md");
        ResolutionContext ctx = context(Map.of("b", path("docs/b.md")), List.of());

        assertEquals(Optional.empty(), new NavUrlLookup().resolve(orphan, "b.md", ctx));
    }

    @Test
    void pageAsDirectoryPrefersBrowserInterpretation() {
        Path source = path("windows-guide/docs/config-params/aplan-for-output.md");

        List<Path> candidates =
                PageAsDirectoryLookup.candidates(source, "../aplan-for-editor.md", root());

        assertEquals(path("windows-guide/docs/config-params/aplan-for-editor.md"), candidates.get(0));
        assertEquals(path("windows-guide/docs/aplan-for-editor.md"), candidates.get(1));
    }

    @Test
    void pageAsDirectoryCrossesIntoSiblingSubsite() {
        mkdirs("programming-reference-guide/docs");
        Path source = touch("release-notes/docs/new-enhanced.md");
        Path target = touch("programming-reference-guide/docs/introduction/arrays/array-notation.md");
        ResolutionContext ctx = context(Map.of(), List.of());

        assertEquals(
                Optional.of(target),
                new PageAsDirectoryLookup()
                        .resolve(
                                source,
                                "../../programming-reference-guide/introduction/arrays/array-notation.md",
                                ctx));
    }

    @Test
    void pageAsDirectoryAbsoluteLinkStaysInOwnSubsite() {
        Path source = path("guide/docs/a/b.md");

        assertEquals(
                List.of(path("guide/docs/x/y.md")),
                PageAsDirectoryLookup.candidates(source, "/x/y.md", root()));
        assertEquals(
                List.of(path("guide/docs/x/y.md")),
                PageAsDirectoryLookup.candidates(source, "/guide/x/y.md", root()));
    }

    @Test
    void pageAsDirectoryOutsideDocsHasNoCandidates() {
        assertTrue(PageAsDirectoryLookup.candidates(path("notes/a.md"), "b.md", root()).isEmpty());
    }

    @Test
    void renderedUrlIsTriedUnderIncludeRoots() {
        Path source = touch("docs/index.md");
        Path target = touch("lang/docs/symbols/comma.md");
        ResolutionContext ctx = context(Map.of("index", source), List.of(path("lang")));

        assertEquals(
                Optional.of(target),
                new RenderedUrlUnderRoots().resolve(source, "symbols/comma.md", ctx));
    }

    @Test
    void renderedUrlPrefersSourceSiteOverIncludeRoots() {
        Path source = touch("guide/docs/index.md");
        Path own = touch("guide/docs/symbols/comma.md");
        touch("lang/docs/symbols/comma.md");
        ResolutionContext ctx = context(Map.of("index", source), List.of(path("lang")));

        assertEquals(
                Optional.of(own),
                new RenderedUrlUnderRoots().resolve(source, "symbols/comma.md", ctx));
    }

    @Test
    void filesystemLookupRootsAbsoluteLinksAtDocs() {
        Path source = touch("site/docs/deep/page.md");
        Path target = touch("site/docs/guide/intro.md");
        ResolutionContext ctx = context(Map.of(), List.of());

        assertEquals(
                Optional.of(target),
                new RawLinkFilesystemLookup().resolve(source, "/guide/intro.md", ctx));
        assertEquals(
                Optional.of(target),
                new RawLinkFilesystemLookup().resolve(source, "../guide/intro.md", ctx));
    }

    @Test
    void parentJoinUsesIndexFallback() {
        Path source = touch("notes/a.md");
        Path index = touch("notes/topic/index.md");
        ResolutionContext ctx = context(Map.of(), List.of());

        assertEquals(Optional.of(index), new SourceParentJoin().resolve(source, "topic.md", ctx));
    }
}

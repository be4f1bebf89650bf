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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LinkNormalizerTest {

    @Test
    void filtersAndCompletesLinks() {
        List<String> raw =
                List.of(
                        "page.md",
                        "page.md#section",
                        "#only-anchor",
                        "https://example.com/x",
                        "http://example.com",
                        "mailto:someone@example.com",
                        "folder/",
                        "no-extension",
                        "image.png",
                        "archive.zip",
                        "/",
                        "  spaced.md  ");

        assertEquals(
                List.of("page.md", "page.md", "folder.md", "no-extension.md", "spaced.md"),
                LinkNormalizer.normalizeAll(raw));
    }

    @Test
    void trailingSlashesAreAllStripped() {
        assertEquals(Optional.of("../guide.md"), LinkNormalizer.normalize("../guide//"));
    }

    @Test
    void dottedDirectoryWithoutExtensionGetsMarkdownSuffix() {
        assertEquals(Optional.of("v1.2/notes.md"), LinkNormalizer.normalize("v1.2/notes"));
    }

    @Test
    void normalizingTwiceChangesNothing() {
        List<String> once =
                LinkNormalizer.normalizeAll(
                        List.of("a", "b/", "c.md#x", "../d/e", "/abs/f/", "g.md"));
        assertEquals(once, LinkNormalizer.normalizeAll(once));
    }
}

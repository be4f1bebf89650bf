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
package net.boyechko.mkdocs.ghost.content;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class StylesheetContentTest {

    @Test
    void extractsLocalUrlReferences() {
        String css =
                ".a { background: url('img/a.png'); }\n"
                        + ".b { background-image: url(\"../b.svg\"); }\n"
                        + ".c { background: url( plain/c.gif ); }\n"
                        + ".d { background: url(data:image/png;base64,AAAA); }\n"
                        + ".e { background: url(https://cdn.example.com/e.png); }\n";

        assertEquals(
                List.of("img/a.png", "../b.svg", "plain/c.gif"), StylesheetContent.imageRefs(css));
    }

    @Test
    void noReferencesInPlainCss() {
        assertTrue(StylesheetContent.imageRefs("body { color: red; }").isEmpty());
    }
}

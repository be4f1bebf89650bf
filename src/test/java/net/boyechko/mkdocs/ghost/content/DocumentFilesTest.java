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
import java.util.Set;
import net.boyechko.mkdocs.ghost.DocTreeTestBase;
import net.boyechko.mkdocs.ghost.core.AuditException;
import org.junit.jupiter.api.Test;

class DocumentFilesTest extends DocTreeTestBase {

    @Test
    void findsMarkdownRecursively() throws AuditException {
        touch("site/docs/a.md");
        touch("site/docs/deep/b.md");
        touch("site/docs/deep/c.txt");
        touch("other/d.md");

        assertEquals(
                Set.of(path("site/docs/a.md"), path("site/docs/deep/b.md")),
                DocumentFiles.markdown(List.of(path("site"))));
    }

    @Test
    void imageExtensionsMatchIgnoringCase() throws AuditException {
        touch("site/docs/img/a.png");
        touch("site/docs/img/B.JPG");
        touch("site/docs/img/c.webp");
        touch("site/docs/img/notes.md");

        assertEquals(
                Set.of(
                        path("site/docs/img/a.png"),
                        path("site/docs/img/B.JPG"),
                        path("site/docs/img/c.webp")),
                DocumentFiles.images(List.of(path("site"))));
    }

    @Test
    void stylesheetWalkSkipsMissingRoots() throws AuditException {
        touch("site/docs/css/extra.css");
        touch("site/theme/_vars.scss");

        assertEquals(
                Set.of(path("site/docs/css/extra.css"), path("site/theme/_vars.scss")),
                DocumentFiles.stylesheets(List.of(path("site"), path("documentation-assets"))));
    }

    @Test
    void missingMarkdownRootIsAnError() {
        assertThrows(
                AuditException.class, () -> DocumentFiles.markdown(List.of(path("does-not-exist"))));
    }
}

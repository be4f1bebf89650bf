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
package net.boyechko.mkdocs.ghost.ui;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import net.boyechko.mkdocs.ghost.DocTreeTestBase;
import net.boyechko.mkdocs.ghost.core.AuditResult;
import net.boyechko.mkdocs.ghost.finding.BrokenLink;
import net.boyechko.mkdocs.ghost.finding.FindingType;
import org.junit.jupiter.api.Test;

class AuditReportTest extends DocTreeTestBase {

    private static AuditResult empty() {
        return new AuditResult(
                List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    @Test
    void writesSummaryAndNonEmptySections() throws IOException {
        AuditResult result =
                new AuditResult(
                        List.of(),
                        List.of(),
                        List.of(),
                        List.of(new BrokenLink(path("guide/docs/a.md"), "b.md", true)),
                        List.of(),
                        List.of(),
                        List.of());
        Path report = path("out/audit.txt");

        AuditReport.write(
                result, path("mkdocs.yml"), ReportSections.defaultSelection(), report);

        String text = Files.readString(report);
        assertTrue(text.startsWith("MkDocs Documentation Audit"));
        assertTrue(text.contains("Broken links: 1"));
        assertTrue(text.contains("Ghost files (orphans): 0"));
        assertTrue(text.contains("Total issues: 1"));
        assertTrue(text.contains("Broken links (1)"));
        assertTrue(text.contains("  - [H] guide/docs/a.md -> b.md"));
        assertFalse(text.contains("Ghost files (orphans) (0)"));
    }

    @Test
    void cleanResultSaysSo() throws IOException {
        Path report = path("audit.txt");

        AuditReport.write(empty(), path("mkdocs.yml"), EnumSet.of(FindingType.GHOST), report);

        String text = Files.readString(report);
        assertTrue(text.contains("Total issues: 0"));
        assertTrue(text.contains("No issues were found."));
        assertFalse(text.contains("Broken links"));
    }
}

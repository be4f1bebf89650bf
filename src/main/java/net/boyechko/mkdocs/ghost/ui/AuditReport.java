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

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import net.boyechko.mkdocs.ghost.core.AuditResult;
import net.boyechko.mkdocs.ghost.finding.FindingType;

/** Writes audit findings to a plain-text report file. */
public final class AuditReport {

    private AuditReport() {}

    /**
     * @param result the findings, already filtered by any subsite exclusions
     * @param navConfig the audited {@code mkdocs.yml}; paths are shown relative to its directory
     * @param selected the sections to include
     * @param reportPath where to write; parent directories are created
     */
    public static void write(
            AuditResult result, Path navConfig, Set<FindingType> selected, Path reportPath)
            throws IOException {
        Path reportParent = reportPath.getParent();
        if (reportParent != null) {
            Files.createDirectories(reportParent);
        }
        Path root = navConfig.getParent();

        try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(reportPath))) {
            writeHeader(out, navConfig);
            List<ReportSections.Section> sections = ReportSections.build(result, root, selected);
            writeSummary(out, sections);

            for (ReportSections.Section section : sections) {
                if (!section.lines().isEmpty()) {
                    writeSection(out, section);
                }
            }
        }
    }

    private static void writeHeader(PrintWriter out, Path navConfig) {
        out.println("MkDocs Documentation Audit");
        out.println("==========================");
        out.println("Config:   " + navConfig);
        out.println("Date:     " + LocalDate.now());
        out.println();
    }

    private static void writeSummary(PrintWriter out, List<ReportSections.Section> sections) {
        out.println("Summary");
        out.println("-------");
        for (ReportSections.Section section : sections) {
            out.println(section.title() + ": " + section.lines().size());
        }
        out.println("Total issues: " + ReportSections.issueCount(sections));
        out.println();
        if (ReportSections.issueCount(sections) == 0) {
            out.println("No issues were found.");
            out.println();
        }
    }

    private static void writeSection(PrintWriter out, ReportSections.Section section) {
        String heading = section.title() + " (" + section.lines().size() + ")";
        out.println(heading);
        out.println("-".repeat(heading.length()));
        for (String line : section.lines()) {
            out.println("  - " + line);
        }
        out.println();
    }
}

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
package net.boyechko.mkdocs.ghost.ui.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;
import net.boyechko.mkdocs.ghost.DocTreeTestBase;
import net.boyechko.mkdocs.ghost.core.VerbosityLevel;
import net.boyechko.mkdocs.ghost.finding.FindingType;
import net.boyechko.mkdocs.ghost.ui.ReportSections;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class GhostCLITest extends DocTreeTestBase {

    private final ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBuffer, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBuffer, true, StandardCharsets.UTF_8);

    @AfterEach
    void restoreLogging() {
        GhostCLI.configureLogging(VerbosityLevel.NORMAL);
    }

    /** A guide subsite with one nav page and, optionally, an unlinked page. */
    private Path site(boolean withGhost) {
        writeNav("guide", "- A: a.md");
        write("guide/docs/a.md", "Nothing linked.\n");
        if (withGhost) {
            write("guide/docs/lonely.md", "Nobody links here.\n");
        }
        return writeNav("", "- Guide: !include guide/mkdocs.yml");
    }

    private int run(String... args) {
        return GhostCLI.run(args, out, err);
    }

    // ── Argument parsing ────────────────────────────────────────────

    @Test
    void positionalConfigGetsDefaults() throws Exception {
        Path config = site(false);

        GhostCLI.CLIConfig cli = GhostCLI.parseArguments(new String[] {config.toString()});

        assertEquals(config, cli.mkdocsYaml());
        assertNull(cli.helpUrls());
        assertEquals(ReportSections.defaultSelection(), cli.sections());
        assertEquals(VerbosityLevel.NORMAL, cli.verbosity());
        assertFalse(cli.summaryOnly());
        assertTrue(cli.excludedSubsites().isEmpty());
    }

    @Test
    void optionsWithSeparateAndInlineValues() throws Exception {
        Path config = site(false);
        Path help = write("help_urls.h", "");

        GhostCLI.CLIConfig cli =
                GhostCLI.parseArguments(
                        new String[] {
                            "--mkdocs-yaml", config.toString(),
                            "--help-urls=" + help,
                            "--exclude", "release-notes, windows-guide",
                            "--report=out/report.txt",
                            "--summary",
                            "-vv"
                        });

        assertEquals(help, cli.helpUrls());
        assertEquals(Set.of("release-notes", "windows-guide"), cli.excludedSubsites());
        assertEquals(Path.of("out/report.txt"), cli.reportPath());
        assertTrue(cli.summaryOnly());
        assertEquals(VerbosityLevel.DEBUG, cli.verbosity());
    }

    @Test
    void sectionFlagsNarrowTheSelectionAndFootnotesAdd() throws Exception {
        Path config = site(false);

        GhostCLI.CLIConfig cli =
                GhostCLI.parseArguments(
                        new String[] {"--ghost", "--broken-links", "--footnotes", config.toString()});

        assertEquals(
                EnumSet.of(FindingType.GHOST, FindingType.BROKEN_LINK, FindingType.FOOTNOTES),
                cli.sections());
    }

    @Test
    void footnotesAloneKeepTheDefaultSections() throws Exception {
        Path config = site(false);

        GhostCLI.CLIConfig cli =
                GhostCLI.parseArguments(new String[] {"--footnotes", config.toString()});

        assertTrue(cli.sections().containsAll(ReportSections.defaultSelection()));
        assertTrue(cli.sections().contains(FindingType.FOOTNOTES));
    }

    @Test
    void badArgumentsAreRejected() {
        Path config = site(false);

        assertThrows(GhostCLI.CLIException.class, () -> GhostCLI.parseArguments(new String[0]));
        assertThrows(
                GhostCLI.CLIException.class,
                () -> GhostCLI.parseArguments(new String[] {"--bogus", config.toString()}));
        assertThrows(
                GhostCLI.CLIException.class,
                () -> GhostCLI.parseArguments(new String[] {path("absent.yml").toString()}));
        assertThrows(
                GhostCLI.CLIException.class,
                () -> GhostCLI.parseArguments(new String[] {config.toString(), "--help-urls"}));
    }

    // ── Exit codes ──────────────────────────────────────────────────

    @Test
    void cleanTreeExitsZero() {
        assertEquals(GhostCLI.EXIT_CLEAN, run(site(false).toString()));
        assertTrue(outBuffer.toString(StandardCharsets.UTF_8).contains("Total issues: 0"));
    }

    @Test
    void findingsExitOne() {
        assertEquals(GhostCLI.EXIT_FINDINGS, run(site(true).toString()));
        assertTrue(outBuffer.toString(StandardCharsets.UTF_8).contains("guide/docs/lonely.md"));
    }

    @Test
    void unselectedFindingsDoNotCount() {
        assertEquals(GhostCLI.EXIT_CLEAN, run("--broken-links", site(true).toString()));
    }

    @Test
    void excludedSubsiteFindingsDoNotCount() {
        assertEquals(GhostCLI.EXIT_CLEAN, run("--exclude=guide", site(true).toString()));
    }

    @Test
    void quietPrintsNothingButKeepsExitCode() {
        assertEquals(GhostCLI.EXIT_FINDINGS, run("-q", site(true).toString()));
        assertEquals("", outBuffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void configurationErrorExitsTwo() {
        Path config = write("mkdocs.yml", "nav: 3\n");

        assertEquals(GhostCLI.EXIT_ERROR, run(config.toString()));
        assertTrue(errBuffer.toString(StandardCharsets.UTF_8).startsWith("Error: "));
    }

    @Test
    void argumentErrorExitsTwo() {
        assertEquals(GhostCLI.EXIT_ERROR, run("--bogus"));
    }

    @Test
    void helpExitsZero() {
        assertEquals(GhostCLI.EXIT_CLEAN, run("--help"));
        assertTrue(outBuffer.toString(StandardCharsets.UTF_8).startsWith("Usage:"));
    }

    @Test
    void reportFileIsWritten() throws IOException {
        Path config = site(true);
        Path report = path("reports/audit.txt");

        assertEquals(GhostCLI.EXIT_FINDINGS, run("--report=" + report, config.toString()));

        String text = Files.readString(report);
        assertTrue(text.contains("Ghost files (orphans) (1)"));
        assertTrue(text.contains("  - guide/docs/lonely.md"));
    }
}

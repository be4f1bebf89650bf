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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import net.boyechko.mkdocs.ghost.core.AuditException;
import net.boyechko.mkdocs.ghost.core.AuditRequest;
import net.boyechko.mkdocs.ghost.core.AuditResult;
import net.boyechko.mkdocs.ghost.core.AuditService;
import net.boyechko.mkdocs.ghost.core.VerbosityLevel;
import net.boyechko.mkdocs.ghost.finding.FindingType;
import net.boyechko.mkdocs.ghost.ui.AuditReport;
import net.boyechko.mkdocs.ghost.ui.AuditReporter;
import net.boyechko.mkdocs.ghost.ui.ReportSections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GhostCLI {
    static final int EXIT_CLEAN = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_ERROR = 2;

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path mkdocsYaml,
            Path helpUrls,
            Set<FindingType> sections,
            boolean summaryOnly,
            VerbosityLevel verbosity,
            Set<String> excludedSubsites,
            Path reportPath) {
        public CLIConfig {
            if (mkdocsYaml == null) {
                throw new IllegalArgumentException("mkdocs.yml path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
            sections = Set.copyOf(sections);
            excludedSubsites = Set.copyOf(excludedSubsites);
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        Path mkdocsYaml;
        Path helpUrls;
        final Set<FindingType> selected = EnumSet.noneOf(FindingType.class);
        boolean footnotes;
        boolean summaryOnly;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;
        Set<String> excludedSubsites = Set.of();
        Path reportPath;

        CLIConfig build() throws CLIException {
            if (mkdocsYaml == null) {
                throw new CLIException("No mkdocs.yml specified");
            }
            if (!Files.isRegularFile(mkdocsYaml)) {
                throw new CLIException("File not found: " + mkdocsYaml);
            }
            if (helpUrls != null && !Files.isRegularFile(helpUrls)) {
                throw new CLIException("File not found: " + helpUrls);
            }

            Set<FindingType> sections =
                    selected.isEmpty()
                            ? ReportSections.defaultSelection()
                            : EnumSet.copyOf(selected);
            if (footnotes) {
                sections.add(FindingType.FOOTNOTES);
            }
            return new CLIConfig(
                    mkdocsYaml,
                    helpUrls,
                    sections,
                    summaryOnly,
                    verbosity,
                    excludedSubsites,
                    reportPath);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs the CLI and returns its exit code: 0 clean, 1 findings, 2 errors. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (isHelpRequested(args)) {
            out.println(usageMessage());
            return EXIT_CLEAN;
        }
        CLIConfig config;
        try {
            config = parseArguments(args);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
        configureLogging(config.verbosity());
        logger().info(
                        "Auditing {} with verbosity level {}",
                        config.mkdocsYaml(),
                        config.verbosity());
        return audit(config, out, err);
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No mkdocs.yml specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--report=")) {
                b.reportPath = Paths.get(args[i].substring("--report=".length()));
            } else if (args[i].startsWith("--exclude=")) {
                b.excludedSubsites = parseCommaSeparated(args[i].substring("--exclude=".length()));
            } else if (args[i].startsWith("--mkdocs-yaml=")) {
                b.mkdocsYaml = Paths.get(args[i].substring("--mkdocs-yaml=".length()));
            } else if (args[i].startsWith("--help-urls=")) {
                b.helpUrls = Paths.get(args[i].substring("--help-urls=".length()));
            } else {
                switch (args[i]) {
                    case "--mkdocs-yaml" -> b.mkdocsYaml = Paths.get(valueAfter(args, i++));
                    case "--help-urls" -> b.helpUrls = Paths.get(valueAfter(args, i++));
                    case "--exclude" ->
                            b.excludedSubsites = parseCommaSeparated(valueAfter(args, i++));
                    case "--nav-missing" -> b.selected.add(FindingType.NAV_MISSING);
                    case "--ghost" -> b.selected.add(FindingType.GHOST);
                    case "--help-missing" -> b.selected.add(FindingType.HELP_MISSING);
                    case "--broken-links" -> b.selected.add(FindingType.BROKEN_LINK);
                    case "--missing-images" -> b.selected.add(FindingType.MISSING_IMAGE);
                    case "--orphan-images" -> b.selected.add(FindingType.ORPHAN_IMAGE);
                    case "--footnotes" -> b.footnotes = true;
                    case "--summary" -> b.summaryOnly = true;
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        } else if (b.mkdocsYaml == null) {
                            b.mkdocsYaml = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Multiple mkdocs.yml files specified");
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static String valueAfter(String[] args, int i) throws CLIException {
        if (i + 1 >= args.length) {
            throw new CLIException("Value not specified after " + args[i]);
        }
        return args[i + 1];
    }

    static void configureLogging(VerbosityLevel verbosity) {
        Level level =
                switch (verbosity) {
                    case QUIET -> Level.ERROR;
                    case NORMAL -> Level.WARN;
                    case VERBOSE -> Level.INFO;
                    case DEBUG -> Level.DEBUG;
                };
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(GhostCLI.class);
        }
        return logger;
    }

    private static int audit(CLIConfig config, PrintStream out, PrintStream err) {
        AuditReporter reporter = new AuditReporter(out, config.verbosity());
        AuditService service = AuditService.builder().withListener(reporter).build();
        AuditRequest request = new AuditRequest(config.mkdocsYaml(), config.helpUrls());

        AuditResult result;
        try {
            result = service.audit(request);
        } catch (AuditException e) {
            reporter.finish();
            err.println("Error: " + e.getMessage());
            logger().debug("Audit failed", e);
            return EXIT_ERROR;
        }

        Path root = request.monorepoRoot();
        AuditResult shown = result.excludingSubsites(root, config.excludedSubsites());
        reporter.report(shown, root, config.sections(), config.summaryOnly());

        if (config.reportPath() != null) {
            try {
                AuditReport.write(
                        shown, request.navConfig(), config.sections(), config.reportPath());
                logger().info("Saved report to {}", config.reportPath());
            } catch (IOException e) {
                err.println(
                        "Error: cannot write report "
                                + config.reportPath()
                                + ": "
                                + e.getMessage());
                return EXIT_ERROR;
            }
        }

        List<ReportSections.Section> sections =
                ReportSections.build(shown, root, config.sections());
        return ReportSections.issueCount(sections) > 0 ? EXIT_FINDINGS : EXIT_CLEAN;
    }

    private static Set<String> parseCommaSeparated(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return "Usage: java GhostCLI [options] [--mkdocs-yaml] <mkdocs.yml>\n"
                + "  -h, --help            Show this help message\n"
                + "  --mkdocs-yaml <path>  Top-level mkdocs.yml of the documentation tree\n"
                + "  --help-urls <path>    Header file with HELP_URL definitions\n"
                + "  --nav-missing         Show nav entries that don't exist on disk\n"
                + "  --ghost               Show markdown files reachable from neither nav nor links\n"
                + "  --help-missing        Show help URLs that don't exist on disk\n"
                + "  --broken-links        Show internal links that resolve to nothing\n"
                + "  --missing-images      Show image references to non-existent files\n"
                + "  --orphan-images       Show images referenced by no page or stylesheet\n"
                + "  --footnotes           Also list pages that use footnotes\n"
                + "  --summary             Show counts only\n"
                + "  --exclude <a,b>       Drop findings in these subsites (comma-separated)\n"
                + "  --report=<file>       Also write the findings to a plain-text report\n"
                + "  -q, --quiet           Print nothing; the exit code tells the result\n"
                + "  -v, --verbose         Show audit phases\n"
                + "  -vv, --debug          Show every link resolution decision\n"
                + "With no section flags, all issue sections are shown.\n"
                + "Exit status: 0 no issues, 1 issues found, 2 error.\n"
                + "Examples:\n"
                + "  java GhostCLI mkdocs.yml\n"
                + "  java GhostCLI --mkdocs-yaml mkdocs.yml --help-urls help_urls.h --summary\n"
                + "  java GhostCLI --broken-links --exclude=release-notes -v mkdocs.yml";
    }
}

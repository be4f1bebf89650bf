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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.boyechko.mkdocs.ghost.core.AuditListener;
import net.boyechko.mkdocs.ghost.core.AuditResult;
import net.boyechko.mkdocs.ghost.core.VerbosityLevel;
import net.boyechko.mkdocs.ghost.finding.FindingType;
import org.slf4j.LoggerFactory;

/**
 * Console output of an audit. Phases appear from VERBOSE up; findings from NORMAL up. QUIET prints
 * nothing but errors. Warnings logged while a phase box is open are shown inside it.
 */
public class AuditReporter implements AuditListener {
    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;

    private boolean phaseOpen = false;
    private final Logger appLogger;
    private final ListAppender<ILoggingEvent> logBuffer;

    public AuditReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
        appLogger = (Logger) LoggerFactory.getLogger("net.boyechko.mkdocs.ghost");
        logBuffer = new ListAppender<>();
        logBuffer.start();
        appLogger.addAppender(logBuffer);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            closePhaseBoxIfOpen();
            printBoxHeader(phaseName);
            phaseOpen = true;
        }
    }

    @Override
    public void onInfo(String message) {
        printLine(message, INFO, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onWarning(String message) {
        printLine(message, WARNING, VerbosityLevel.NORMAL);
    }

    @Override
    public void onComplete(AuditResult result) {
        closePhaseBoxIfOpen();
    }

    /** Closes any phase box left open, e.g. after an aborted audit, and stops buffering logs. */
    public void finish() {
        closePhaseBoxIfOpen();
        detachLogBuffer();
    }

    /**
     * Prints each selected section in its own box, or just the per-section counts when {@code
     * summaryOnly}, and then the issue total.
     */
    public void report(
            AuditResult result, Path root, Set<FindingType> selected, boolean summaryOnly) {
        if (!verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            detachLogBuffer();
            return;
        }
        closePhaseBoxIfOpen();
        List<ReportSections.Section> sections = ReportSections.build(result, root, selected);

        if (!summaryOnly) {
            for (ReportSections.Section section : sections) {
                printBoxHeader(section.title() + " (" + section.lines().size() + ")");
                if (section.lines().isEmpty()) {
                    printLine("None", SUCCESS, VerbosityLevel.NORMAL);
                }
                String icon = section.type().isIssue() ? WARNING : INFO;
                for (String line : section.lines()) {
                    printLine(line, icon, VerbosityLevel.NORMAL);
                }
                printBoxFooter();
            }
        }

        printBoxHeader("Summary");
        for (ReportSections.Section section : sections) {
            int count = section.lines().size();
            String icon = count == 0 ? SUCCESS : section.type().isIssue() ? WARNING : INFO;
            printLine(section.title() + ": " + count, icon, VerbosityLevel.NORMAL);
        }
        int total = ReportSections.issueCount(sections);
        printEmptyLine();
        printLine("Total issues: " + total, total == 0 ? SUCCESS : WARNING, VerbosityLevel.NORMAL);
        printBoxFooter();
        detachLogBuffer();
    }

    private void detachLogBuffer() {
        appLogger.detachAppender(logBuffer);
        logBuffer.stop();
    }

    private void closePhaseBoxIfOpen() {
        if (phaseOpen) {
            printBoxFooter();
            phaseOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
        output.println("│");
    }

    private void printBoxFooter() {
        drainLogBuffer();
        output.println("│");
        output.println("└─╯");
    }

    /** Flushes warnings and errors logged since the last drain into the open box. */
    private void drainLogBuffer() {
        List<ILoggingEvent> events = new ArrayList<>();
        for (ILoggingEvent event : new ArrayList<>(logBuffer.list)) {
            if (event.getLevel().isGreaterOrEqual(Level.WARN)) {
                events.add(event);
            }
        }
        logBuffer.list.clear();
        if (events.isEmpty() || !verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            return;
        }
        printEmptyLine();
        for (ILoggingEvent event : events) {
            String icon = event.getLevel().isGreaterOrEqual(Level.ERROR) ? ERROR : WARNING;
            printLine(
                    "[" + event.getLevel() + "] " + event.getFormattedMessage(),
                    icon,
                    VerbosityLevel.NORMAL);
        }
    }

    /**
     * Prints an indented line with the given icon, word-wrapping long messages to stay within the
     * box width. Continuation lines align with the message start.
     */
    private void printLine(String message, String icon, VerbosityLevel level) {
        if (!verbosity.isAtLeast(level)) {
            return;
        }
        String prefix = INDENT + icon + " ";
        String continuationPrefix = INDENT + "  ";
        List<String> lines = wordWrap(message, LINE_WIDTH);
        if (lines.isEmpty()) {
            output.println(INDENT.stripTrailing());
            return;
        }
        output.println(prefix + lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            output.println(continuationPrefix + lines.get(i));
        }
    }

    private void printEmptyLine() {
        output.println(INDENT.stripTrailing());
    }

    /** Word-wraps text at spaces to fit within maxWidth characters per line. */
    static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxWidth) {
            return List.of(text);
        }

        List<String> lines = new ArrayList<>();
        StringBuilder currentLine = new StringBuilder();
        for (String word : text.split(" ")) {
            if (currentLine.length() == 0) {
                currentLine.append(word);
            } else if (currentLine.length() + 1 + word.length() <= maxWidth) {
                currentLine.append(' ').append(word);
            } else {
                lines.add(currentLine.toString());
                currentLine.setLength(0);
                currentLine.append(word);
            }
        }
        if (currentLine.length() > 0) {
            lines.add(currentLine.toString());
        }
        return lines;
    }
}

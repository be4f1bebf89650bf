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
package net.boyechko.mkdocs.ghost.help;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.mkdocs.ghost.core.AuditException;
import net.boyechko.mkdocs.ghost.link.PathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the help index, a C header whose {@code HELP_URL("key", expr)} calls name documentation
 * pages. An {@code expr} is a string literal, a {@code #define}d macro, or a concatenation of
 * both. Its value is a path whose first segment is a subsite; the page lives at
 * {@code <root>/<subsite>/docs/<rest>.md}.
 */
public final class HelpIndexParser {
    private static final Logger logger = LoggerFactory.getLogger(HelpIndexParser.class);

    private static final Pattern DEFINE = Pattern.compile("#define\\s+(\\w+)\\s+\"([^\"]+)\"");
    private static final Pattern HELP_URL =
            Pattern.compile("HELP_URL\\s*\\(\"(?:[^\"]|\\\\\")*\"\\s*,\\s*([^)]+)\\)");

    private HelpIndexParser() {}

    /** Returns the expected page for every call, in file order, duplicates kept. */
    public static List<Path> parse(Path helpIndex, Path root) throws AuditException {
        String raw;
        try {
            raw = Files.readString(helpIndex);
        } catch (IOException e) {
            throw new AuditException(
                    "Cannot read help index " + helpIndex + ": " + e.getMessage(), helpIndex, e);
        }
        List<Path> pages = new ArrayList<>();
        for (String url : helpUrls(raw)) {
            pages.add(PathNormalizer.join(root, injectDocs(url) + ".md"));
        }
        logger.debug("Help index {} names {} pages", helpIndex, pages.size());
        return pages;
    }

    /** The expanded URL of every {@code HELP_URL} call outside comments. */
    static List<String> helpUrls(String source) {
        String content = stripComments(source);
        Map<String, String> macros = new HashMap<>();
        Matcher define = DEFINE.matcher(content);
        while (define.find()) {
            macros.put(define.group(1), define.group(2).trim());
        }

        List<String> urls = new ArrayList<>();
        Matcher call = HELP_URL.matcher(content);
        while (call.find()) {
            urls.add(expand(call.group(1).trim(), macros));
        }
        return urls;
    }

    /** Removes C line and block comments; a line comment keeps its newline. */
    static String stripComments(String source) {
        StringBuilder out = new StringBuilder(source.length());
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            char next = i + 1 < n ? source.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                int eol = source.indexOf('\n', i + 2);
                if (eol < 0) {
                    break;
                }
                out.append('\n');
                i = eol + 1;
            } else if (c == '/' && next == '*') {
                int close = source.indexOf("*/", i + 2);
                if (close < 0) {
                    break;
                }
                i = close + 2;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /** Concatenates the quoted and macro parts of an expression; unknown names stay literal. */
    static String expand(String expression, Map<String, String> macros) {
        StringBuilder url = new StringBuilder();
        for (String part : expression.split("\"")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            url.append(macros.getOrDefault(trimmed, trimmed));
        }
        return url.toString();
    }

    /** {@code guide/intro/page} becomes {@code guide/docs/intro/page}. */
    static String injectDocs(String path) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty() && !segment.equals(".")) {
                segments.add(segment);
            }
        }
        if (segments.isEmpty()) {
            return "docs";
        }
        segments.add(1, "docs");
        return String.join("/", segments);
    }
}

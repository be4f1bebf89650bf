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

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.StringJoiner;

/**
 * Lexical path and URL algebra. Nothing here touches the filesystem: whether a path exists is a
 * question for the callers, and often exactly the thing they are trying to find out.
 */
public final class PathNormalizer {
    private PathNormalizer() {}

    /** Resolves {@code .} and {@code ..} segments of a filesystem path. */
    public static Path normalize(Path path) {
        return path.normalize();
    }

    /** Joins {@code relative} onto {@code base} and normalizes the result. */
    public static Path join(Path base, String relative) {
        return normalize(base.resolve(stripLeadingSlashes(relative)));
    }

    /**
     * Normalizes a slash-separated URL path: empty and {@code .} segments are dropped, {@code ..}
     * removes the preceding segment (or nothing at the top), and the remainder is joined with
     * {@code /} without leading or trailing slashes.
     */
    public static String normalizeUrl(String url) {
        Deque<String> parts = new ArrayDeque<>();
        for (String segment : url.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                parts.pollLast();
            } else {
                parts.addLast(segment);
            }
        }
        StringJoiner joined = new StringJoiner("/");
        parts.forEach(joined::add);
        return joined.toString();
    }

    /** Joins two URL paths with a single slash; either side may be empty. */
    public static String joinUrl(String base, String relative) {
        if (base.isEmpty()) {
            return relative;
        }
        if (relative.isEmpty()) {
            return base;
        }
        return base + "/" + relative;
    }

    /** Returns everything before the last segment of a URL path, or "" for a single segment. */
    public static String parentUrl(String url) {
        int slash = url.lastIndexOf('/');
        return slash < 0 ? "" : url.substring(0, slash);
    }

    /** Removes the extension of the final segment, if it has one. */
    public static String stripExtension(String path) {
        int slash = path.lastIndexOf('/');
        String name = path.substring(slash + 1);
        int dot = extensionDot(name);
        return dot < 0 ? path : path.substring(0, slash + 1 + dot);
    }

    /** Returns the extension of the final segment without the dot, or null when there is none. */
    public static String extension(String path) {
        String name = fileName(path);
        int dot = extensionDot(name);
        return dot < 0 ? null : name.substring(dot + 1);
    }

    /** Returns the final segment without its extension. */
    public static String fileStem(String path) {
        return stripExtension(fileName(path));
    }

    /** Converts a relative filesystem path into a slash-joined URL path. */
    public static String toUrl(Path relative) {
        StringJoiner joined = new StringJoiner("/");
        for (Path name : relative) {
            String segment = name.toString();
            if (!segment.isEmpty()) {
                joined.add(segment);
            }
        }
        return normalizeUrl(joined.toString());
    }

    public static String stripLeadingSlashes(String path) {
        int i = 0;
        while (i < path.length() && path.charAt(i) == '/') {
            i++;
        }
        return path.substring(i);
    }

    private static String fileName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    // A leading dot marks a hidden file, not an extension.
    private static int extensionDot(String name) {
        if (name.equals("..")) {
            return -1;
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? dot : -1;
    }
}

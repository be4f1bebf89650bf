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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The two inverse maps between rendered URLs and source files, built once per audit.
 *
 * @param urlToSource canonical rendered URL to the source file serving it
 * @param sourceToUrl source file to its canonical rendered URL
 */
public record LinkMaps(Map<String, Path> urlToSource, Map<Path, String> sourceToUrl) {
    public LinkMaps {
        urlToSource = Collections.unmodifiableMap(new LinkedHashMap<>(urlToSource));
        sourceToUrl = Collections.unmodifiableMap(new LinkedHashMap<>(sourceToUrl));
    }

    public static LinkMaps empty() {
        return new LinkMaps(Map.of(), Map.of());
    }

    public Optional<String> urlFor(Path source) {
        return Optional.ofNullable(sourceToUrl.get(source));
    }

    /**
     * Looks up a rendered URL, then the same URL without a trailing slash, then with an
     * {@code /index} suffix, the way a server falls back to a directory index.
     */
    public Optional<Path> sourceFor(String renderedUrl) {
        Path hit = urlToSource.get(renderedUrl);
        if (hit != null) {
            return Optional.of(hit);
        }
        String trimmed = renderedUrl;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        hit = urlToSource.get(trimmed);
        if (hit != null) {
            return Optional.of(hit);
        }
        return Optional.ofNullable(urlToSource.get(trimmed + "/index"));
    }
}

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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw link destinations into markdown paths worth resolving. Anchors are cut, external and
 * {@code mailto:} links are dropped, directory-style links become {@code .md} pages, links to
 * other file types are dropped, and extensionless links gain {@code .md}.
 */
public final class LinkNormalizer {
    private static final String MARKDOWN_EXTENSION = "md";

    private LinkNormalizer() {}

    public static List<String> normalizeAll(List<String> rawLinks) {
        List<String> links = new ArrayList<>();
        for (String raw : rawLinks) {
            normalize(raw).ifPresent(links::add);
        }
        return links;
    }

    public static Optional<String> normalize(String raw) {
        int hash = raw.indexOf('#');
        String link = (hash >= 0 ? raw.substring(0, hash) : raw).trim();
        if (link.isEmpty()) {
            return Optional.empty();
        }
        if (link.startsWith("http") || link.startsWith("mailto:")) {
            return Optional.empty();
        }

        if (link.endsWith("/")) {
            while (link.endsWith("/")) {
                link = link.substring(0, link.length() - 1);
            }
            return link.isEmpty() ? Optional.empty() : Optional.of(link + ".md");
        }

        String extension = PathNormalizer.extension(link);
        if (extension == null) {
            return Optional.of(link + ".md");
        }
        return MARKDOWN_EXTENSION.equals(extension) ? Optional.of(link) : Optional.empty();
    }
}

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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Extracts {@code url(...)} references from CSS and SCSS sources. */
public final class StylesheetContent {
    private static final Pattern URL_REF =
            Pattern.compile("url\\s*\\(\\s*['\"]?([^'\")]+)['\"]?\\s*\\)");

    private StylesheetContent() {}

    /** Local references only; {@code data:} URIs and http(s) URLs are skipped. */
    public static List<String> imageRefs(String css) {
        List<String> refs = new ArrayList<>();
        Matcher m = URL_REF.matcher(css);
        while (m.find()) {
            String url = m.group(1).trim();
            if (!ImageRefs.isExternal(url)) {
                refs.add(url);
            }
        }
        return refs;
    }
}

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import net.boyechko.mkdocs.ghost.nav.NavItem;
import net.boyechko.mkdocs.ghost.nav.NavTree;
import net.boyechko.mkdocs.ghost.nav.PageCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the virtual URL hierarchy declared by a nav tree onto the filesystem.
 *
 * <p>Sections contribute a slug of their title as a URL segment. Includes contribute the included
 * site's directory, relative to the top-level site, as literal segments. Both maps keep the first
 * mapping written for a key.
 */
public final class LinkMapBuilder {
    private static final Logger logger = LoggerFactory.getLogger(LinkMapBuilder.class);

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]+");

    private final Map<String, Path> urlToSource = new LinkedHashMap<>();
    private final Map<Path, String> sourceToUrl = new LinkedHashMap<>();

    private LinkMapBuilder() {}

    public static LinkMaps build(NavTree tree) {
        LinkMapBuilder builder = new LinkMapBuilder();
        builder.walk(tree, tree.items(), tree.directory(), "");
        logger.debug("Mapped {} rendered URLs", builder.urlToSource.size());
        return new LinkMaps(builder.urlToSource, builder.sourceToUrl);
    }

    private void walk(NavTree tree, List<NavItem> items, Path siteRoot, String urlPrefix) {
        for (NavItem item : items) {
            if (item instanceof NavItem.Page page) {
                if (page.includeTarget().isPresent()) {
                    NavTree child = tree.include(page.includeTarget().get());
                    walk(child, child.items(), siteRoot, includePrefix(urlPrefix, siteRoot, child));
                } else {
                    insert(page.target(), tree.directory(), urlPrefix);
                }
            } else if (item instanceof NavItem.Section section) {
                String prefix = PathNormalizer.joinUrl(urlPrefix, slugify(section.title()));
                walk(tree, section.children(), siteRoot, prefix);
            } else if (item instanceof NavItem.PlainPath plain) {
                insert(plain.target(), tree.directory(), urlPrefix);
            }
        }
    }

    private static String includePrefix(String urlPrefix, Path siteRoot, NavTree child) {
        Path childDir = child.directory();
        if (!childDir.startsWith(siteRoot)) {
            return urlPrefix;
        }
        String relative = PathNormalizer.toUrl(siteRoot.relativize(childDir));
        return PathNormalizer.joinUrl(urlPrefix, relative);
    }

    private void insert(String navPath, Path siteDir, String urlPrefix) {
        Path source = PageCollector.pagePath(siteDir, navPath);
        String rendered = renderedUrl(navPath, urlPrefix);
        urlToSource.putIfAbsent(rendered, source);
        sourceToUrl.putIfAbsent(source, rendered);
    }

    /**
     * At the top level a page keeps its whole path, minus the extension. Under a section or
     * include, only its file stem is appended to the prefix.
     */
    static String renderedUrl(String navPath, String urlPrefix) {
        if (urlPrefix.isEmpty()) {
            return PathNormalizer.normalizeUrl(PathNormalizer.stripExtension(navPath));
        }
        return PathNormalizer.normalizeUrl(
                PathNormalizer.joinUrl(urlPrefix, PathNormalizer.fileStem(navPath)));
    }

    /** Non-alphanumeric runs become one hyphen; ends trimmed; lower-cased. */
    public static String slugify(String title) {
        String slug = NON_ALPHANUMERIC.matcher(title).replaceAll("-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end).toLowerCase(Locale.ROOT);
    }
}

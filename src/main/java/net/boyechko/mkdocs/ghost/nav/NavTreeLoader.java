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
package net.boyechko.mkdocs.ghost.nav;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.boyechko.mkdocs.ghost.core.AuditException;
import net.boyechko.mkdocs.ghost.link.PathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads an {@code mkdocs.yml} nav into a {@link NavTree}, following every {@code !include}
 * directive. Include targets resolve against the directory of the config that names them.
 *
 * <p>Any read or decode failure, at any depth, aborts the load: a partial nav tree would make
 * every later resolution decision unreliable.
 */
public final class NavTreeLoader {
    private static final Logger logger = LoggerFactory.getLogger(NavTreeLoader.class);

    private static final String NAV_KEY = "nav";

    public NavTree load(Path configFile) throws AuditException {
        return load(PathNormalizer.normalize(configFile.toAbsolutePath()), Set.of());
    }

    private NavTree load(Path configFile, Set<Path> enteredOnBranch) throws AuditException {
        if (enteredOnBranch.contains(configFile)) {
            throw new AuditException("Cyclic !include of " + configFile, configFile);
        }
        Set<Path> entered = new HashSet<>(enteredOnBranch);
        entered.add(configFile);

        List<NavItem> items = decodeNav(parse(configFile), configFile);
        Map<String, NavTree> includes = new LinkedHashMap<>();
        for (String target : includeTargets(items)) {
            if (includes.containsKey(target)) {
                continue;
            }
            Path includeFile = PathNormalizer.join(configFile.getParent(), target);
            logger.debug("Loading include {} from {}", includeFile, configFile);
            includes.put(target, load(includeFile, entered));
        }

        logger.debug(
                "Loaded {} top-level nav entries and {} includes from {}",
                items.size(),
                includes.size(),
                configFile);
        return new NavTree(configFile, items, includes);
    }

    private static Object parse(Path configFile) throws AuditException {
        String contents;
        try {
            contents = Files.readString(configFile);
        } catch (IOException e) {
            throw new AuditException(
                    "Cannot read nav config " + configFile + ": " + e.getMessage(), configFile, e);
        }
        try {
            Yaml yaml = new Yaml(new NavYamlConstructor(loaderOptions()));
            return yaml.load(contents);
        } catch (YAMLException e) {
            throw new AuditException(
                    "Malformed nav config " + configFile + ": " + e.getMessage(), configFile, e);
        }
    }

    /** Global tags such as {@code !!python/name:} must reach the constructor's fallback. */
    static LoaderOptions loaderOptions() {
        LoaderOptions options = new LoaderOptions();
        options.setTagInspector(tag -> true);
        return options;
    }

    /** Decodes the {@code nav} value of a parsed config document. */
    static List<NavItem> decodeNav(Object document, Path source) throws AuditException {
        if (!(document instanceof Map<?, ?> config)) {
            throw malformed(source, "document is not a mapping");
        }
        if (!(config.get(NAV_KEY) instanceof List<?> nav)) {
            throw malformed(source, "missing or non-list 'nav' key");
        }
        return decodeList(nav, source);
    }

    private static List<NavItem> decodeList(List<?> entries, Path source) throws AuditException {
        List<NavItem> items = new ArrayList<>();
        for (Object entry : entries) {
            items.addAll(decodeEntry(entry, source));
        }
        return items;
    }

    /**
     * Decodes one list entry. The YAML carries no tags for nav shapes, so the shapes are tried in
     * a fixed order: title-to-path mapping, title-to-list mapping, bare path.
     */
    private static List<NavItem> decodeEntry(Object entry, Path source) throws AuditException {
        Optional<List<NavItem>> pages = decodePages(entry);
        if (pages.isPresent()) {
            return pages.get();
        }
        Optional<List<NavItem>> sections = decodeSections(entry, source);
        if (sections.isPresent()) {
            return sections.get();
        }
        if (entry instanceof String path) {
            return List.of(NavItem.plainPath(path));
        }
        throw malformed(source, "unrecognized nav entry " + entry);
    }

    private static Optional<List<NavItem>> decodePages(Object entry) {
        if (!(entry instanceof Map<?, ?> map) || map.isEmpty()) {
            return Optional.empty();
        }
        List<NavItem> pages = new ArrayList<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getValue() instanceof String target)) {
                return Optional.empty();
            }
            pages.add(NavItem.page(String.valueOf(e.getKey()), target));
        }
        return Optional.of(pages);
    }

    private static Optional<List<NavItem>> decodeSections(Object entry, Path source)
            throws AuditException {
        if (!(entry instanceof Map<?, ?> map) || map.isEmpty()) {
            return Optional.empty();
        }
        for (Object value : map.values()) {
            if (!(value instanceof List)) {
                return Optional.empty();
            }
        }
        List<NavItem> sections = new ArrayList<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            List<NavItem> children = decodeList((List<?>) e.getValue(), source);
            sections.add(NavItem.section(String.valueOf(e.getKey()), children));
        }
        return Optional.of(sections);
    }

    /** Include targets named anywhere in this config's own items, sections included. */
    static List<String> includeTargets(List<NavItem> items) {
        List<String> targets = new ArrayList<>();
        for (NavItem item : items) {
            if (item instanceof NavItem.Page page) {
                page.includeTarget().ifPresent(targets::add);
            } else if (item instanceof NavItem.Section section) {
                targets.addAll(includeTargets(section.children()));
            }
        }
        return targets;
    }

    private static AuditException malformed(Path source, String detail) {
        return new AuditException("Malformed nav config " + source + ": " + detail, source);
    }
}

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
package net.boyechko.mkdocs.ghost.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import net.boyechko.mkdocs.ghost.content.MarkdownContent;
import net.boyechko.mkdocs.ghost.finding.BrokenLink;
import net.boyechko.mkdocs.ghost.link.LinkNormalizer;
import net.boyechko.mkdocs.ghost.link.LinkResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows links outward from a seed set of pages until no new page turns up. Each round reads the
 * pages not yet scanned, resolves their links, and queues the resolved targets that exist on disk.
 * The scanned set only grows, so the loop ends once every reachable page has been read.
 */
public class TransitiveScanner {
    private static final Logger logger = LoggerFactory.getLogger(TransitiveScanner.class);

    private final LinkResolver resolver;

    public TransitiveScanner(LinkResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @param scanned every page read, including unreadable ones
     * @param referenced every link target resolved, plus the help pages
     * @param brokenLinks unresolvable links, sorted by page then link
     * @param pagesWithFootnotes scanned pages containing footnotes
     */
    public record ScanResult(
            Set<Path> scanned,
            Set<Path> referenced,
            List<BrokenLink> brokenLinks,
            Set<Path> pagesWithFootnotes) {
        public ScanResult {
            scanned = Set.copyOf(scanned);
            referenced = Set.copyOf(referenced);
            brokenLinks = List.copyOf(brokenLinks);
            pagesWithFootnotes = Set.copyOf(pagesWithFootnotes);
        }
    }

    public ScanResult scan(Collection<Path> seed, Set<Path> helpPages) {
        Set<Path> scanned = new TreeSet<>();
        Set<Path> referenced = new TreeSet<>(helpPages);
        Set<Path> footnotes = new TreeSet<>();
        List<BrokenLink> broken = new ArrayList<>();

        Set<Path> toScan = new TreeSet<>();
        for (Path page : seed) {
            if (Files.isRegularFile(page)) {
                toScan.add(page);
            }
        }

        int round = 0;
        while (!toScan.isEmpty()) {
            Map<Path, String> batch = new LinkedHashMap<>();
            for (Path page : toScan) {
                if (scanned.add(page)) {
                    read(page).ifPresent(content -> batch.put(page, content));
                }
            }
            if (batch.isEmpty()) {
                break;
            }
            round++;

            Set<Path> found = new TreeSet<>();
            for (Map.Entry<Path, String> entry : batch.entrySet()) {
                analyze(entry.getKey(), entry.getValue(), helpPages, found, broken);
                if (MarkdownContent.hasFootnotes(entry.getValue())) {
                    footnotes.add(entry.getKey());
                }
            }

            toScan = new TreeSet<>();
            for (Path target : found) {
                if (!scanned.contains(target) && Files.isRegularFile(target)) {
                    toScan.add(target);
                }
            }
            referenced.addAll(found);
            logger.debug(
                    "Scan round {}: read {} pages, {} new to follow",
                    round,
                    batch.size(),
                    toScan.size());
        }

        broken.sort(BrokenLink.ORDER);
        logger.info("Scanned {} pages in {} rounds", scanned.size(), round);
        return new ScanResult(scanned, referenced, broken, footnotes);
    }

    private void analyze(
            Path page,
            String content,
            Set<Path> helpPages,
            Set<Path> found,
            List<BrokenLink> broken) {
        boolean fromHelp = helpPages.contains(page);
        for (String link : LinkNormalizer.normalizeAll(MarkdownContent.parse(content).links())) {
            Optional<Path> target = resolver.resolve(page, link);
            if (target.isPresent()) {
                found.add(target.get());
            } else {
                broken.add(new BrokenLink(page, link, fromHelp));
            }
        }
    }

    private static Optional<String> read(Path page) {
        try {
            return Optional.of(Files.readString(page));
        } catch (IOException e) {
            logger.warn("Cannot read {}, treating it as having no links: {}", page, e.getMessage());
            return Optional.empty();
        }
    }
}

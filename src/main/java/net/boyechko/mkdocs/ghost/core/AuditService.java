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
package net.boyechko.mkdocs.ghost.core;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import net.boyechko.mkdocs.ghost.content.DocumentFiles;
import net.boyechko.mkdocs.ghost.help.HelpIndexParser;
import net.boyechko.mkdocs.ghost.image.ImageAuditor;
import net.boyechko.mkdocs.ghost.image.ImageResolver;
import net.boyechko.mkdocs.ghost.link.LinkMapBuilder;
import net.boyechko.mkdocs.ghost.link.LinkMaps;
import net.boyechko.mkdocs.ghost.link.LinkResolver;
import net.boyechko.mkdocs.ghost.link.ResolutionContext;
import net.boyechko.mkdocs.ghost.link.ResolutionDefaults;
import net.boyechko.mkdocs.ghost.link.ResolutionStrategy;
import net.boyechko.mkdocs.ghost.nav.NavTree;
import net.boyechko.mkdocs.ghost.nav.NavTreeLoader;
import net.boyechko.mkdocs.ghost.nav.PageCollector;
import net.boyechko.mkdocs.ghost.scan.OrphanDetector;
import net.boyechko.mkdocs.ghost.scan.TransitiveScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Orchestrates the audit of an MkDocs documentation tree. */
public class AuditService {
    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private final AuditListener listener;
    private final List<ResolutionStrategy> strategies;

    public static class AuditServiceBuilder {
        private AuditListener listener = new AuditListener() {};
        private List<ResolutionStrategy> strategies = ResolutionDefaults.strategies();

        public AuditServiceBuilder withListener(AuditListener listener) {
            this.listener = listener;
            return this;
        }

        public AuditServiceBuilder withStrategies(List<ResolutionStrategy> strategies) {
            this.strategies = List.copyOf(strategies);
            return this;
        }

        public AuditService build() {
            if (listener == null) {
                throw new IllegalStateException("AuditListener must not be null");
            }
            return new AuditService(this);
        }
    }

    public static AuditServiceBuilder builder() {
        return new AuditServiceBuilder();
    }

    private AuditService(AuditServiceBuilder builder) {
        this.listener = builder.listener;
        this.strategies = builder.strategies;
    }

    /**
     * Runs a complete audit. Configuration errors abort with {@link AuditException}; everything
     * missing on disk is reported in the result instead.
     */
    public AuditResult audit(AuditRequest request) throws AuditException {
        Path root = request.monorepoRoot();

        listener.onPhaseStart("Loading navigation");
        NavTree tree = new NavTreeLoader().load(request.navConfig());
        Set<Path> pages = PageCollector.collectPages(tree);
        List<Path> navMissing = missing(pages);
        List<Path> includeRoots = PageCollector.includeRoots(tree);
        listener.onInfo(pages.size() + " nav pages across " + includeRoots.size() + " subsites");
        if (includeRoots.isEmpty()) {
            listener.onWarning(
                    "No !include directives in "
                            + request.navConfig()
                            + "; ghost and orphan image checks have nothing to walk");
        }

        listener.onPhaseStart("Walking subsites");
        Set<Path> markdown = DocumentFiles.markdown(includeRoots);
        LinkMaps linkMaps = LinkMapBuilder.build(tree);

        Set<Path> helpPages = new LinkedHashSet<>();
        if (request.helpIndexPath().isPresent()) {
            listener.onPhaseStart("Reading help index");
            helpPages.addAll(HelpIndexParser.parse(request.helpIndex(), root));
        }
        List<Path> helpMissing = missing(helpPages);

        listener.onPhaseStart("Following links");
        ResolutionContext ctx = new ResolutionContext(linkMaps, root, includeRoots, markdown);
        TransitiveScanner scanner = new TransitiveScanner(new LinkResolver(strategies, ctx));
        Set<Path> seed = new LinkedHashSet<>(pages);
        seed.addAll(helpPages);
        TransitiveScanner.ScanResult scan = scanner.scan(seed, helpPages);
        List<Path> ghost = OrphanDetector.ghosts(markdown, pages, scan.referenced());

        listener.onPhaseStart("Checking images");
        Set<Path> images = DocumentFiles.images(includeRoots);
        List<Path> stylesheetRoots = new ArrayList<>(includeRoots);
        stylesheetRoots.add(root.resolve(DocumentFiles.ASSETS_DIR));
        Set<Path> stylesheets = DocumentFiles.stylesheets(stylesheetRoots);
        ImageAuditor.Result imageAudit =
                new ImageAuditor(new ImageResolver(images, includeRoots))
                        .audit(new TreeSet<>(scan.scanned()), stylesheets);
        List<Path> orphanImages =
                images.stream()
                        .filter(image -> !imageAudit.referenced().contains(image))
                        .sorted()
                        .toList();

        AuditResult result =
                new AuditResult(
                        navMissing,
                        ghost,
                        helpMissing,
                        scan.brokenLinks(),
                        imageAudit.missing(),
                        orphanImages,
                        scan.pagesWithFootnotes().stream().sorted().toList());
        logger.info("Audit of {} found {} issues", request.navConfig(), result.totalIssues());
        listener.onComplete(result);
        return result;
    }

    /** Paths that are not regular files, sorted and de-duplicated. */
    private static List<Path> missing(Set<Path> paths) {
        Set<Path> missing = new TreeSet<>();
        for (Path path : paths) {
            if (!Files.isRegularFile(path)) {
                missing.add(path);
            }
        }
        return List.copyOf(missing);
    }
}

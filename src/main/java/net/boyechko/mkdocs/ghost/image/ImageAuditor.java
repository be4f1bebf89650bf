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
package net.boyechko.mkdocs.ghost.image;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import net.boyechko.mkdocs.ghost.content.ImageRefs;
import net.boyechko.mkdocs.ghost.content.MarkdownContent;
import net.boyechko.mkdocs.ghost.content.StylesheetContent;
import net.boyechko.mkdocs.ghost.finding.BrokenImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks image references in scanned pages and stylesheets. Only pages can produce missing
 * images; stylesheet references that do not resolve may point at build output and are ignored.
 */
public class ImageAuditor {
    private static final Logger logger = LoggerFactory.getLogger(ImageAuditor.class);

    private final ImageResolver resolver;

    public ImageAuditor(ImageResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @param missing unresolved page references, sorted
     * @param referenced every image any page or stylesheet resolved to
     */
    public record Result(List<BrokenImage> missing, Set<Path> referenced) {
        public Result {
            missing = List.copyOf(missing);
            referenced = Set.copyOf(referenced);
        }
    }

    public Result audit(Collection<Path> pages, Collection<Path> stylesheets) {
        List<BrokenImage> missing = new ArrayList<>();
        Set<Path> referenced = new TreeSet<>();

        for (Path page : pages) {
            Optional<String> content = read(page);
            if (content.isEmpty()) {
                continue;
            }
            for (String ref : ImageRefs.localOnly(MarkdownContent.parse(content.get()).images())) {
                Optional<Path> target = resolver.resolve(page, ref);
                if (target.isPresent()) {
                    referenced.add(target.get());
                } else {
                    missing.add(new BrokenImage(page, ref));
                }
            }
        }

        for (Path stylesheet : stylesheets) {
            Optional<String> content = read(stylesheet);
            if (content.isEmpty()) {
                continue;
            }
            for (String ref : StylesheetContent.imageRefs(content.get())) {
                resolver.resolve(stylesheet, ref).ifPresent(referenced::add);
            }
        }

        missing.sort(BrokenImage.ORDER);
        logger.debug("{} image references resolved, {} missing", referenced.size(), missing.size());
        return new Result(missing, referenced);
    }

    private static Optional<String> read(Path file) {
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            logger.warn("Cannot read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}

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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Stream;
import net.boyechko.mkdocs.ghost.core.AuditException;
import net.boyechko.mkdocs.ghost.link.PathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Recursive walks for the files an audit cares about. Results are normalized and sorted. */
public final class DocumentFiles {
    private static final Logger logger = LoggerFactory.getLogger(DocumentFiles.class);

    public static final Set<String> IMAGE_EXTENSIONS =
            Set.of("png", "jpg", "jpeg", "gif", "svg", "webp", "ico", "bmp");
    public static final Set<String> STYLESHEET_EXTENSIONS = Set.of("css", "scss");
    public static final String ASSETS_DIR = "documentation-assets";

    private DocumentFiles() {}

    public static Set<Path> markdown(Collection<Path> roots) throws AuditException {
        return walk(roots, path -> "md".equals(extension(path)));
    }

    /** Image extensions match case-insensitively. */
    public static Set<Path> images(Collection<Path> roots) throws AuditException {
        return walk(
                roots,
                path -> {
                    String ext = extension(path);
                    return ext != null && IMAGE_EXTENSIONS.contains(ext.toLowerCase(Locale.ROOT));
                });
    }

    /** Roots that do not exist are skipped. */
    public static Set<Path> stylesheets(Collection<Path> roots) throws AuditException {
        Set<Path> existing = new TreeSet<>();
        for (Path root : roots) {
            if (Files.exists(root)) {
                existing.add(root);
            }
        }
        return walk(
                existing,
                path -> {
                    String ext = extension(path);
                    return ext != null && STYLESHEET_EXTENSIONS.contains(ext);
                });
    }

    private static Set<Path> walk(Collection<Path> roots, Predicate<Path> accept)
            throws AuditException {
        Set<Path> found = new TreeSet<>();
        for (Path root : roots) {
            try (Stream<Path> paths = Files.walk(root)) {
                paths.filter(Files::isRegularFile)
                        .filter(accept)
                        .map(PathNormalizer::normalize)
                        .forEach(found::add);
            } catch (IOException | UncheckedIOException e) {
                throw new AuditException(
                        "Cannot walk directory " + root + ": " + e.getMessage(), root, e);
            }
            logger.debug("Walked {}: {} matching files so far", root, found.size());
        }
        return found;
    }

    private static String extension(Path path) {
        Path name = path.getFileName();
        return name == null ? null : PathNormalizer.extension(name.toString());
    }
}

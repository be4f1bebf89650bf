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
package net.boyechko.mkdocs.ghost;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.mkdocs.ghost.core.AuditException;
import net.boyechko.mkdocs.ghost.core.AuditRequest;
import net.boyechko.mkdocs.ghost.core.AuditResult;
import net.boyechko.mkdocs.ghost.core.AuditService;
import org.junit.jupiter.api.io.TempDir;

/** Base for tests that build a documentation tree on disk under a temporary monorepo root. */
public abstract class DocTreeTestBase {

    @TempDir protected Path tempDir;

    /** The monorepo root; absolute and normalized so it compares equal to audit paths. */
    protected final Path root() {
        return tempDir.toAbsolutePath().normalize();
    }

    // ── Fixture writing ─────────────────────────────────────────────

    /** Writes {@code content} to {@code relative} under the root, creating parent directories. */
    protected final Path write(String relative, String content) {
        Path file = root().resolve(relative);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write fixture: " + file, e);
        }
        return file;
    }

    /** Writes an empty file, e.g. an image. */
    protected final Path touch(String relative) {
        return write(relative, "");
    }

    protected final Path mkdirs(String relative) {
        Path dir = root().resolve(relative);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create fixture dir: " + dir, e);
        }
        return dir;
    }

    /** Writes {@code mkdocs.yml} with the given nav lines under {@code siteDir} ("" for root). */
    protected final Path writeNav(String siteDir, String... navLines) {
        StringBuilder yaml = new StringBuilder("site_name: test\nnav:\n");
        for (String line : navLines) {
            yaml.append("  ").append(line).append('\n');
        }
        String relative = siteDir.isEmpty() ? "mkdocs.yml" : siteDir + "/mkdocs.yml";
        return write(relative, yaml.toString());
    }

    protected final Path path(String relative) {
        return root().resolve(relative).normalize();
    }

    // ── Running audits ──────────────────────────────────────────────

    protected final AuditResult audit(Path navConfig) throws AuditException {
        return AuditService.builder().build().audit(AuditRequest.of(navConfig));
    }

    protected final AuditResult audit(Path navConfig, Path helpIndex) throws AuditException {
        return AuditService.builder().build().audit(new AuditRequest(navConfig, helpIndex));
    }
}

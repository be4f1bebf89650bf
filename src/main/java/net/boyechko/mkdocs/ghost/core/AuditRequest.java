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

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Inputs of one audit.
 *
 * @param navConfig the top-level {@code mkdocs.yml}; its directory is the monorepo root
 * @param helpIndex the help index header, or null to audit without one
 */
public record AuditRequest(Path navConfig, Path helpIndex) {
    public AuditRequest {
        Objects.requireNonNull(navConfig, "navConfig");
        navConfig = navConfig.toAbsolutePath().normalize();
        helpIndex = helpIndex == null ? null : helpIndex.toAbsolutePath().normalize();
    }

    public static AuditRequest of(Path navConfig) {
        return new AuditRequest(navConfig, null);
    }

    public Optional<Path> helpIndexPath() {
        return Optional.ofNullable(helpIndex);
    }

    public Path monorepoRoot() {
        return navConfig.getParent();
    }
}

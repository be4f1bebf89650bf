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

/**
 * A configuration error that invalidates the whole audit: an unreadable or malformed nav config,
 * a broken include, an unreadable help index, or a failed directory walk. Findings are never
 * reported this way.
 */
public class AuditException extends Exception {
    private final Path source;

    public AuditException(String message, Path source) {
        super(message);
        this.source = source;
    }

    public AuditException(String message, Path source, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /** The file the error originated from, or null when no single file is to blame. */
    public Path source() {
        return source;
    }
}

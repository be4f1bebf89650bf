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

import java.util.List;
import net.boyechko.mkdocs.ghost.link.strategies.NavUrlLookup;
import net.boyechko.mkdocs.ghost.link.strategies.PageAsDirectoryLookup;
import net.boyechko.mkdocs.ghost.link.strategies.RawLinkFilesystemLookup;
import net.boyechko.mkdocs.ghost.link.strategies.RenderedUrlUnderRoots;
import net.boyechko.mkdocs.ghost.link.strategies.SourceParentJoin;

public final class ResolutionDefaults {
    private ResolutionDefaults() {}

    public static List<ResolutionStrategy> strategies() {
        return List.of(
                new NavUrlLookup(),
                new PageAsDirectoryLookup(),
                new RenderedUrlUnderRoots(),
                new RawLinkFilesystemLookup(),
                new SourceParentJoin());
    }
}

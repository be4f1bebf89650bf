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
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps normalized links back to markdown files by trying each {@link ResolutionStrategy} in turn.
 * A link none of them can place is broken.
 */
public class LinkResolver {
    private static final Logger logger = LoggerFactory.getLogger(LinkResolver.class);

    private final List<ResolutionStrategy> strategies;
    private final ResolutionContext context;

    public LinkResolver(ResolutionContext context) {
        this(ResolutionDefaults.strategies(), context);
    }

    public LinkResolver(List<ResolutionStrategy> strategies, ResolutionContext context) {
        this.strategies = List.copyOf(strategies);
        this.context = context;
    }

    public List<ResolutionStrategy> getStrategies() {
        return strategies;
    }

    public Optional<Path> resolve(Path source, String link) {
        for (ResolutionStrategy strategy : strategies) {
            Optional<Path> target = strategy.resolve(source, link, context);
            if (target.isPresent()) {
                logger.debug(
                        "Resolved {} -> {} via {}: {}",
                        source,
                        link,
                        strategy.name(),
                        target.get());
                return target;
            }
        }
        logger.debug("Broken link {} -> {}", source, link);
        return Optional.empty();
    }
}

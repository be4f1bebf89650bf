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

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

/**
 * SnakeYAML constructor for {@code mkdocs.yml} files.
 *
 * <p>An unquoted {@code !include path} is a YAML tag rather than a string, so it is folded back
 * into the string {@code "!include path"} and decodes exactly like the quoted form. Any other
 * unknown tag ({@code !!python/name:...}, {@code !ENV ...}) is read as its plain value, since
 * MkDocs configs carry plenty of those outside {@code nav}.
 */
class NavYamlConstructor extends SafeConstructor {
    static final Tag INCLUDE_TAG = new Tag(IncludeDirective.TOKEN);

    NavYamlConstructor(LoaderOptions options) {
        super(options);
        this.yamlConstructors.put(INCLUDE_TAG, new ConstructInclude());
        this.yamlConstructors.put(null, new ConstructUntagged());
    }

    private class ConstructInclude extends AbstractConstruct {
        @Override
        public Object construct(Node node) {
            if (node instanceof ScalarNode) {
                return IncludeDirective.TOKEN + " " + constructScalar((ScalarNode) node);
            }
            return constructPlain(node);
        }
    }

    private class ConstructUntagged extends AbstractConstruct {
        @Override
        public Object construct(Node node) {
            return constructPlain(node);
        }
    }

    private Object constructPlain(Node node) {
        return switch (node.getNodeId()) {
            case scalar -> constructScalar((ScalarNode) node);
            case sequence -> constructSequence((SequenceNode) node);
            default -> constructMapping((MappingNode) node);
        };
    }
}

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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.Link;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Link and image destinations found in one markdown page, in document order. Both markdown syntax
 * and raw HTML ({@code <a href>}, {@code <img src>}) contribute. Destinations are returned as
 * written; filtering is left to the caller.
 *
 * @param links hyperlink destinations
 * @param images image sources
 */
public record MarkdownContent(List<String> links, List<String> images) {
    private static final Parser PARSER = Parser.builder().build();
    private static final Pattern FOOTNOTE = Pattern.compile("\\[\\^[^\\]]+\\]");

    public MarkdownContent {
        links = List.copyOf(links);
        images = List.copyOf(images);
    }

    public static MarkdownContent parse(String markdown) {
        Node document = PARSER.parse(markdown);
        DestinationCollector collector = new DestinationCollector();
        document.accept(collector);
        return new MarkdownContent(collector.links, collector.images);
    }

    /** True when the page has a footnote reference or definition such as {@code [^1]}. */
    public static boolean hasFootnotes(String markdown) {
        return FOOTNOTE.matcher(markdown).find();
    }

    private static final class DestinationCollector extends AbstractVisitor {
        private final List<String> links = new ArrayList<>();
        private final List<String> images = new ArrayList<>();

        @Override
        public void visit(Link link) {
            addIfPresent(links, link.getDestination());
            visitChildren(link);
        }

        @Override
        public void visit(Image image) {
            addIfPresent(images, image.getDestination());
            visitChildren(image);
        }

        @Override
        public void visit(HtmlInline htmlInline) {
            collectHtml(htmlInline.getLiteral());
        }

        @Override
        public void visit(HtmlBlock htmlBlock) {
            collectHtml(htmlBlock.getLiteral());
        }

        private void collectHtml(String html) {
            if (html == null || html.isBlank()) {
                return;
            }
            Document fragment = Jsoup.parseBodyFragment(html);
            for (Element anchor : fragment.select("a[href]")) {
                links.add(anchor.attr("href"));
            }
            for (Element img : fragment.select("img[src]")) {
                images.add(img.attr("src"));
            }
        }

        private static void addIfPresent(List<String> into, String destination) {
            if (destination != null && !destination.isEmpty()) {
                into.add(destination);
            }
        }
    }
}

/*
 * Word2Md - Word Document to Markdown Conversion
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
package net.boyechko.word2md.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.boyechko.word2md.content.ContentExtractor;
import net.boyechko.word2md.content.ContentItem;
import net.boyechko.word2md.document.DocNode;
import net.boyechko.word2md.document.NodeKind;
import net.boyechko.word2md.media.ImageCounters;
import net.boyechko.word2md.media.ImageLinks;
import net.boyechko.word2md.table.TableFlattener;
import net.boyechko.word2md.walk.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a document tree into Markdown, one body-level paragraph or table at a time.
 *
 * <p>Paragraphs whose only non-blank content is math become display blocks; otherwise math is
 * inlined between single dollar signs. Tables become HTML blocks. Image numbering is taken from
 * the {@link ImageCounters} of the supplied {@link ImageLinks}, so the same tree converts to the
 * same text given counters in the same state.
 */
public class DocumentAssembler {
    private static final Logger logger = LoggerFactory.getLogger(DocumentAssembler.class);

    static final String BLOCK_SEPARATOR = "\n\n";
    static final String LIST_MARKER = "- ";
    private static final String HEADING_STYLE_PREFIX = "heading";
    private static final int MAX_HEADING_LEVEL = 6;

    private final ContentExtractor extractor;
    private final TableFlattener tables;

    public DocumentAssembler(ContentExtractor extractor) {
        this.extractor = extractor;
        this.tables = new TableFlattener(extractor);
    }

    public String assemble(DocNode root, ImageLinks links) {
        return assemble(root, links, new ConversionStats());
    }

    public String assemble(DocNode root, ImageLinks links, ConversionStats stats) {
        DocNode body = root.is(NodeKind.BODY) ? root : TreeWalker.findFirst(root, NodeKind.BODY);
        if (body == null) {
            body = root;
        }

        ImageCounters counters = links.counters();
        int rasterStart = counters.peekRaster();
        int vectorStart = counters.peekVector();

        List<String> blocks = new ArrayList<>();
        for (DocNode node : body.children()) {
            convertBlock(node, links, stats, blocks, true);
        }

        stats.addImages(counters.peekRaster() - rasterStart, counters.peekVector() - vectorStart);
        logger.debug("Assembled {} blocks: {}", blocks.size(), stats);
        return String.join(BLOCK_SEPARATOR, blocks);
    }

    // Containers such as w:sdt are opened one level deep only.
    private void convertBlock(
            DocNode node,
            ImageLinks links,
            ConversionStats stats,
            List<String> blocks,
            boolean openContainers) {
        try {
            switch (node.kind()) {
                case PARAGRAPH -> {
                    String line = renderParagraph(node, links, stats);
                    if (!line.isEmpty()) {
                        blocks.add(line);
                        stats.addParagraph();
                    }
                }
                case TABLE -> {
                    String html = tables.toHtml(node, links);
                    if (!html.isEmpty()) {
                        blocks.add(html);
                        stats.addTable();
                    }
                }
                default -> {
                    if (openContainers) {
                        stats.addOtherNode();
                        for (DocNode child : node.children()) {
                            convertBlock(child, links, stats, blocks, false);
                        }
                    }
                }
            }
        } catch (RuntimeException e) {
            logger.error("Failed to convert {}: {}", node, e.getMessage());
            stats.addFailedNode();
        }
    }

    String renderParagraph(DocNode paragraph, ImageLinks links, ConversionStats stats) {
        List<ContentItem> items = extractor.extractMerged(paragraph);

        boolean hasText = false;
        int mathCount = 0;
        for (ContentItem item : items) {
            if (item instanceof ContentItem.Text t && !t.value().isBlank()) {
                hasText = true;
            } else if (item instanceof ContentItem.Math) {
                mathCount++;
            }
        }
        stats.addMathItems(mathCount);
        boolean display = mathCount > 0 && !hasText;

        StringBuilder content = new StringBuilder();
        StringBuilder pendingDisplay = new StringBuilder();
        for (ContentItem item : items) {
            if (display && item instanceof ContentItem.Math math) {
                pendingDisplay.append(math.value());
                continue;
            }
            flushDisplay(content, pendingDisplay);

            if (item instanceof ContentItem.Math math) {
                content.append(" $ ").append(math.value()).append(" $ ");
            } else if (item instanceof ContentItem.ImageRef image) {
                content.append(links.render(image));
            } else if (item instanceof ContentItem.VectorImageRef image) {
                content.append(links.render(image));
            } else {
                content.append(item.value());
            }
        }
        flushDisplay(content, pendingDisplay);

        if (content.length() == 0) {
            return "";
        }

        DocNode props = TreeWalker.firstChild(paragraph, NodeKind.PARAGRAPH_PROPERTIES);
        String line = headingPrefix(props) + content;
        if (TreeWalker.firstChild(props, NodeKind.NUMBERING_PROPERTIES) != null) {
            line = LIST_MARKER + line;
        }
        return line;
    }

    private static void flushDisplay(StringBuilder content, StringBuilder pending) {
        if (pending.length() > 0) {
            content.append("\n\n$$\n").append(pending).append("\n$$\n\n");
            pending.setLength(0);
        }
    }

    /** {@code "## "} for a paragraph styled {@code Heading2}; empty for non-heading styles. */
    static String headingPrefix(DocNode paragraphProperties) {
        DocNode style = TreeWalker.firstChild(paragraphProperties, NodeKind.PARAGRAPH_STYLE);
        String styleId = style != null ? style.val() : null;
        if (styleId == null
                || !styleId.toLowerCase(Locale.ROOT).startsWith(HEADING_STYLE_PREFIX)) {
            return "";
        }
        return "#".repeat(headingLevel(styleId)) + " ";
    }

    static int headingLevel(String styleId) {
        StringBuilder digits = new StringBuilder();
        for (char c : styleId.toCharArray()) {
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        if (digits.length() == 0) {
            return 1;
        }
        int level;
        try {
            level = Integer.parseInt(digits.toString());
        } catch (NumberFormatException e) {
            level = MAX_HEADING_LEVEL;
        }
        return Math.max(1, Math.min(MAX_HEADING_LEVEL, level));
    }
}

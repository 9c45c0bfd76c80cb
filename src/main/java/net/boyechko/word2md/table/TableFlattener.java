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
package net.boyechko.word2md.table;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.word2md.content.ContentExtractor;
import net.boyechko.word2md.content.ContentItem;
import net.boyechko.word2md.document.DocNode;
import net.boyechko.word2md.document.NodeKind;
import net.boyechko.word2md.media.ImageLinks;
import net.boyechko.word2md.walk.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Flattens a {@code w:tbl} into an HTML table block. */
public class TableFlattener {
    private static final Logger logger = LoggerFactory.getLogger(TableFlattener.class);

    static final String LINE_BREAK = "<br/>";

    private final ContentExtractor extractor;

    public TableFlattener(ContentExtractor extractor) {
        this.extractor = extractor;
    }

    public String toHtml(DocNode table, ImageLinks links) {
        return grid(table, links).toHtml();
    }

    /** Renders every cell of the table's direct rows; rows without cells are skipped. */
    public CellGrid grid(DocNode table, ImageLinks links) {
        List<List<String>> rows = new ArrayList<>();
        for (DocNode row : TreeWalker.children(table, NodeKind.TABLE_ROW)) {
            List<String> cells = new ArrayList<>();
            for (DocNode cell : TreeWalker.children(row, NodeKind.TABLE_CELL)) {
                cells.add(cellText(cell, links));
            }
            if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        CellGrid grid = new CellGrid(rows);
        logger.debug(
                "Table {}: {} x {}, header={}",
                table,
                grid.height(),
                grid.width(),
                grid.hasHeaderRow());
        return grid;
    }

    private String cellText(DocNode cell, ImageLinks links) {
        List<String> paragraphs = new ArrayList<>();
        for (DocNode p : TreeWalker.children(cell, NodeKind.PARAGRAPH)) {
            String text = paragraphText(extractor.extractMerged(p), links);
            if (!text.isEmpty()) {
                paragraphs.add(text);
            }
        }
        return String.join(LINE_BREAK, paragraphs).strip();
    }

    static String paragraphText(List<ContentItem> items, ImageLinks links) {
        StringBuilder sb = new StringBuilder();
        for (ContentItem item : items) {
            if (item instanceof ContentItem.Math math) {
                sb.append('$').append(math.value().strip()).append('$');
            } else if (item instanceof ContentItem.ImageRef image) {
                sb.append(links.render(image));
            } else if (item instanceof ContentItem.VectorImageRef image) {
                sb.append(links.render(image));
            } else {
                sb.append(item.value());
            }
        }
        return sb.toString().replace("\n", LINE_BREAK).strip();
    }
}

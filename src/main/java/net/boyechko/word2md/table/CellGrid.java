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
import java.util.Collections;
import java.util.List;

/**
 * Rectangular grid of rendered cell strings. Rows shorter than the widest row are padded on the
 * right with empty cells.
 */
public final class CellGrid {
    private final List<List<String>> rows;
    private final int width;

    public CellGrid(List<List<String>> rows) {
        int max = 0;
        for (List<String> row : rows) {
            max = Math.max(max, row.size());
        }
        List<List<String>> padded = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> copy = new ArrayList<>(row);
            while (copy.size() < max) {
                copy.add("");
            }
            padded.add(Collections.unmodifiableList(copy));
        }
        this.rows = Collections.unmodifiableList(padded);
        this.width = max;
    }

    public List<List<String>> rows() {
        return rows;
    }

    public int width() {
        return width;
    }

    public int height() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * The first row is treated as a header when none of its cells is blank. Word's own header-row
     * flag is not consulted.
     */
    public boolean hasHeaderRow() {
        return !rows.isEmpty() && rows.get(0).stream().noneMatch(String::isBlank);
    }

    /** HTML table block surrounded by blank lines, or the empty string for an empty grid. */
    public String toHtml() {
        if (rows.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        lines.add("<table border=\"1\">");

        List<List<String>> bodyRows = rows;
        if (hasHeaderRow()) {
            lines.add("  <thead>");
            appendRow(lines, rows.get(0), "th");
            lines.add("  </thead>");
            bodyRows = rows.subList(1, rows.size());
        }

        lines.add("  <tbody>");
        for (List<String> row : bodyRows) {
            appendRow(lines, row, "td");
        }
        lines.add("  </tbody>");
        lines.add("</table>");
        return "\n\n" + String.join("\n", lines) + "\n\n";
    }

    private static void appendRow(List<String> lines, List<String> row, String cellTag) {
        lines.add("    <tr>");
        for (String cell : row) {
            lines.add("      <" + cellTag + ">" + cell + "</" + cellTag + ">");
        }
        lines.add("    </tr>");
    }
}

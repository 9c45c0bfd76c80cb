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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class CellGridTest {

    @Test
    void shortRowsArePaddedToWidestRow() {
        CellGrid grid =
                new CellGrid(List.of(List.of("a", "b", "c"), List.of("d"), List.of("e", "f")));

        assertEquals(3, grid.width());
        assertEquals(3, grid.height());
        assertEquals(List.of("d", "", ""), grid.rows().get(1));
        assertEquals(List.of("e", "f", ""), grid.rows().get(2));
    }

    @Test
    void headerRowRequiresEveryCellNonBlank() {
        assertTrue(new CellGrid(List.of(List.of("a", "b"))).hasHeaderRow());
        assertFalse(new CellGrid(List.of(List.of("", "b"))).hasHeaderRow());
        assertFalse(new CellGrid(List.of(List.of(" ", "b"))).hasHeaderRow());
    }

    @Test
    void paddingCanRemoveHeader() {
        CellGrid grid = new CellGrid(List.of(List.of("a"), List.of("b", "c")));

        assertFalse(grid.hasHeaderRow());
    }

    @Test
    void rendersHeaderAndBody() {
        String expected =
                "\n\n<table border=\"1\">\n"
                        + "  <thead>\n"
                        + "    <tr>\n"
                        + "      <th>a</th>\n"
                        + "    </tr>\n"
                        + "  </thead>\n"
                        + "  <tbody>\n"
                        + "    <tr>\n"
                        + "      <td>b</td>\n"
                        + "    </tr>\n"
                        + "  </tbody>\n"
                        + "</table>\n\n";

        assertEquals(expected, new CellGrid(List.of(List.of("a"), List.of("b"))).toHtml());
    }

    @Test
    void rendersBodyOnlyWithoutHeader() {
        String expected =
                "\n\n<table border=\"1\">\n"
                        + "  <tbody>\n"
                        + "    <tr>\n"
                        + "      <td></td>\n"
                        + "      <td>b</td>\n"
                        + "    </tr>\n"
                        + "  </tbody>\n"
                        + "</table>\n\n";

        assertEquals(expected, new CellGrid(List.of(List.of("", "b"))).toHtml());
    }

    @Test
    void headerOnlyTableHasEmptyBody() {
        String html = new CellGrid(List.of(List.of("h"))).toHtml();

        assertTrue(html.contains("  <tbody>\n  </tbody>\n"));
    }

    @Test
    void emptyGridRendersNothing() {
        CellGrid grid = new CellGrid(List.of());

        assertTrue(grid.isEmpty());
        assertEquals(0, grid.width());
        assertEquals("", grid.toHtml());
    }
}

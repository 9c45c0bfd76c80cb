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

/** Counts gathered while assembling one document. */
public final class ConversionStats {
    private int paragraphs;
    private int tables;
    private int mathItems;
    private int rasterImages;
    private int vectorImages;
    private int otherNodes;
    private int failedNodes;

    void addParagraph() {
        paragraphs++;
    }

    void addTable() {
        tables++;
    }

    void addMathItems(int count) {
        mathItems += count;
    }

    void addImages(int raster, int vector) {
        rasterImages += raster;
        vectorImages += vector;
    }

    void addOtherNode() {
        otherNodes++;
    }

    void addFailedNode() {
        failedNodes++;
    }

    public int paragraphs() {
        return paragraphs;
    }

    public int tables() {
        return tables;
    }

    public int mathItems() {
        return mathItems;
    }

    public int rasterImages() {
        return rasterImages;
    }

    public int vectorImages() {
        return vectorImages;
    }

    public int otherNodes() {
        return otherNodes;
    }

    public int failedNodes() {
        return failedNodes;
    }

    @Override
    public String toString() {
        return String.format(
                "paragraphs=%d tables=%d math=%d images=%d/%d other=%d failed=%d",
                paragraphs,
                tables,
                mathItems,
                rasterImages,
                vectorImages,
                otherNodes,
                failedNodes);
    }
}

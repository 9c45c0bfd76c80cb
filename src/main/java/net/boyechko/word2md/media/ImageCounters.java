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
package net.boyechko.word2md.media;

/**
 * Next image numbers for raster and vector references, both starting at 1. One instance belongs
 * to one document conversion.
 */
public final class ImageCounters {
    private int raster = 1;
    private int vector = 1;

    /** Returns the current number for {@code kind} and advances it. */
    public int next(MediaKind kind) {
        return switch (kind) {
            case RASTER -> raster++;
            case VECTOR -> vector++;
            case BINARY -> throw new IllegalArgumentException("Binary media is not referenced");
        };
    }

    public int peekRaster() {
        return raster;
    }

    public int peekVector() {
        return vector;
    }

    public void reset() {
        raster = 1;
        vector = 1;
    }
}

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
package net.boyechko.word2md.content;

/** One classified unit of paragraph content, in document order. */
public sealed interface ContentItem {

    /** The item's textual payload: literal text, LaTeX source, or the image display name. */
    String value();

    record Text(String value) implements ContentItem {}

    /** LaTeX source without surrounding delimiters. */
    record Math(String value) implements ContentItem {}

    record Superscript(String value) implements ContentItem {}

    record Subscript(String value) implements ContentItem {}

    /** An embedded raster image, addressed by relationship id. */
    record ImageRef(String relationshipId, String displayName) implements ContentItem {
        @Override
        public String value() {
            return displayName;
        }
    }

    /** A legacy vector image (WMF/EMF), addressed by relationship id. */
    record VectorImageRef(String relationshipId, String displayName) implements ContentItem {
        @Override
        public String value() {
            return displayName;
        }
    }
}

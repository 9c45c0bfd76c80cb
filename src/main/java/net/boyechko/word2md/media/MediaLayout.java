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
 * Where extracted media lives relative to the Markdown, e.g. {@code ../Images/report_images/PNG}.
 *
 * @param mediaRoot the media directory as referenced from Markdown
 * @param rasterDir subdirectory for raster images
 * @param vectorDir subdirectory for WMF/EMF images
 * @param binaryDir subdirectory for embedded OLE payloads
 */
public record MediaLayout(String mediaRoot, String rasterDir, String vectorDir, String binaryDir) {

    public static final MediaLayout DEFAULT = new MediaLayout("../Images", "PNG", "WMF", "BIN");

    public String dirFor(MediaKind kind) {
        return switch (kind) {
            case RASTER -> rasterDir;
            case VECTOR -> vectorDir;
            case BINARY -> binaryDir;
        };
    }

    public static String imagesDirName(String documentName) {
        return documentName + "_images";
    }
}

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

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** The media families we extract, each written to its own directory. */
public enum MediaKind {
    RASTER(Set.of("png", "jpg", "jpeg", "gif", "bmp", "tif", "tiff", "webp")),
    VECTOR(Set.of("wmf", "emf", "wmz", "svg")),
    BINARY(Set.of("bin"));

    private final Set<String> extensions;

    MediaKind(Set<String> extensions) {
        this.extensions = extensions;
    }

    public Set<String> extensions() {
        return extensions;
    }

    public static Optional<MediaKind> forExtension(String extension) {
        String ext = extension.toLowerCase(Locale.ROOT);
        for (MediaKind kind : values()) {
            if (kind.extensions.contains(ext)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static Optional<MediaKind> forFileName(String fileName) {
        return forExtension(extensionOf(fileName));
    }

    /** Lower-case extension without the dot, or the empty string. */
    public static String extensionOf(String fileName) {
        int slash = fileName.lastIndexOf('/');
        int dot = fileName.lastIndexOf('.');
        if (dot <= slash + 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}

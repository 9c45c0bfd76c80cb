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

/** Decides the file extension used in an image link, without the dot. */
@FunctionalInterface
public interface ImageExtensionResolver {

    String extensionFor(MediaKind kind, String relationshipId);

    /** Always answers with the given per-kind extensions. */
    static ImageExtensionResolver fixed(String rasterExtension, String vectorExtension) {
        return (kind, relationshipId) ->
                kind == MediaKind.VECTOR ? vectorExtension : rasterExtension;
    }
}

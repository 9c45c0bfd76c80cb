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

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of converting one document.
 *
 * @param markdown the converted text
 * @param outputPath where the text was written, or null if it was not written
 * @param stats counts gathered during assembly
 * @param extractedMedia media files written to disk, in extraction order
 */
public record ConversionResult(
        String markdown, Path outputPath, ConversionStats stats, List<Path> extractedMedia) {

    public ConversionResult {
        extractedMedia = List.copyOf(extractedMedia);
    }

    public boolean hasFailures() {
        return stats.failedNodes() > 0;
    }
}

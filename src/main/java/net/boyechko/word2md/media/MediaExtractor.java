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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.word2md.core.ConversionException;
import net.boyechko.word2md.document.DocxPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies embedded media out of a package into {@code {imagesDir}/{doc}_images/{kind dir}/}, named
 * {@code image{N}.{ext}} with one sequence per media kind.
 *
 * <p>Within a kind, parts whose file stem does not end in digits are written first, in package
 * order, followed by the rest in ascending order of that trailing number.
 */
public class MediaExtractor {
    private static final Logger logger = LoggerFactory.getLogger(MediaExtractor.class);

    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)$");

    /** One part to copy and the file name it gets. */
    public record PlannedFile(String partName, MediaKind kind, int number, String fileName) {}

    private final MediaLayout layout;

    public MediaExtractor(MediaLayout layout) {
        this.layout = layout;
    }

    public List<Path> extract(DocxPackage docx, Path imagesDir) throws ConversionException {
        Path base = imagesDir.resolve(MediaLayout.imagesDirName(docx.documentName()));
        List<PlannedFile> plan = plan(docx.mediaPartNames());
        List<Path> written = new ArrayList<>();

        for (PlannedFile file : plan) {
            Path target = base.resolve(layout.dirFor(file.kind())).resolve(file.fileName());
            try (InputStream in = docx.openPart(file.partName())) {
                Files.createDirectories(target.getParent());
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new ConversionException(
                        "Cannot write " + target + ": " + e.getMessage(), e);
            }
            logger.debug("{} -> {}", file.partName(), target);
            written.add(target);
        }
        logger.info("Extracted {} media files to {}", written.size(), base);
        return written;
    }

    /** Orders and names media parts; parts of no known kind are left out. */
    public static List<PlannedFile> plan(List<String> partNames) {
        Map<MediaKind, List<String>> byKind = new EnumMap<>(MediaKind.class);
        for (String name : partNames) {
            Optional<MediaKind> kind = MediaKind.forFileName(name);
            if (kind.isPresent()) {
                byKind.computeIfAbsent(kind.get(), k -> new ArrayList<>()).add(name);
            } else {
                logger.debug("Skipping media part {}", name);
            }
        }

        List<PlannedFile> plan = new ArrayList<>();
        for (Map.Entry<MediaKind, List<String>> entry : byKind.entrySet()) {
            List<String> unnumbered = new ArrayList<>();
            List<String> numbered = new ArrayList<>();
            for (String name : entry.getValue()) {
                if (trailingNumber(name) != null) {
                    numbered.add(name);
                } else {
                    unnumbered.add(name);
                }
            }
            numbered.sort(Comparator.comparingLong(MediaExtractor::trailingNumber));

            int n = 1;
            for (String name : concat(unnumbered, numbered)) {
                String fileName = "image" + n + "." + MediaKind.extensionOf(name);
                plan.add(new PlannedFile(name, entry.getKey(), n, fileName));
                n++;
            }
        }
        return plan;
    }

    private static List<String> concat(List<String> first, List<String> second) {
        List<String> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    /** Trailing digits of the file stem, or null. */
    static Long trailingNumber(String partName) {
        String fileName = partName.substring(partName.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        Matcher m = TRAILING_NUMBER.matcher(stem);
        if (!m.find()) {
            return null;
        }
        try {
            return Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}

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
package net.boyechko.word2md.document;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.word2md.core.ConversionException;
import net.boyechko.word2md.media.ImageExtensionResolver;
import net.boyechko.word2md.media.MediaKind;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.exceptions.InvalidOperationException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackageAccess;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.PackageRelationshipCollection;
import org.apache.poi.openxml4j.opc.PackageRelationshipTypes;
import org.apache.poi.openxml4j.opc.PackagingURIHelper;
import org.apache.poi.openxml4j.opc.TargetMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only view of a {@code .docx} package: the main document part, its relationships and the
 * embedded media. The package is never written back.
 */
public class DocxPackage implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(DocxPackage.class);

    private static final List<String> MEDIA_FOLDERS = List.of("/word/media/", "/word/embeddings/");

    private final Path path;
    private final OPCPackage pkg;
    private final PackagePart mainPart;

    private DocxPackage(Path path, OPCPackage pkg, PackagePart mainPart) {
        this.path = path;
        this.pkg = pkg;
        this.mainPart = mainPart;
    }

    public static DocxPackage open(Path path) throws ConversionException {
        OPCPackage pkg;
        try {
            pkg = OPCPackage.open(path.toFile(), PackageAccess.READ);
        } catch (InvalidFormatException
                | InvalidOperationException
                | UnsupportedFileFormatException e) {
            throw new ConversionException("Cannot open " + path + ": " + e.getMessage(), e);
        }

        PackagePart main = findMainPart(pkg);
        if (main == null) {
            pkg.revert();
            throw new ConversionException("No main document part in " + path);
        }
        logger.debug("Opened {} (main part {})", path, main.getPartName().getName());
        return new DocxPackage(path, pkg, main);
    }

    private static PackagePart findMainPart(OPCPackage pkg) {
        for (String type :
                List.of(
                        PackageRelationshipTypes.CORE_DOCUMENT,
                        PackageRelationshipTypes.STRICT_CORE_DOCUMENT)) {
            PackageRelationshipCollection rels = pkg.getRelationshipsByType(type);
            if (rels.size() > 0) {
                return pkg.getPart(rels.getRelationship(0));
            }
        }
        return null;
    }

    public Path path() {
        return path;
    }

    /** File name without extension; used to name the media directory. */
    public String documentName() {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    public DocTree readDocumentTree() throws ConversionException {
        try (InputStream in = mainPart.getInputStream()) {
            return DocTreeBuilder.parse(in);
        } catch (IOException e) {
            throw new ConversionException(
                    "Cannot read " + mainPart.getPartName().getName() + ": " + e.getMessage(), e);
        }
    }

    /** Internal relationships of the main document part, id to target part name. */
    public Map<String, String> relationshipTargets() throws ConversionException {
        Map<String, String> targets = new LinkedHashMap<>();
        try {
            URI source = mainPart.getPartName().getURI();
            for (PackageRelationship rel : mainPart.getRelationships()) {
                if (rel.getTargetMode() == TargetMode.EXTERNAL) {
                    continue;
                }
                URI target = PackagingURIHelper.resolvePartUri(source, rel.getTargetURI());
                targets.put(rel.getId(), target.toString());
            }
        } catch (InvalidFormatException e) {
            throw new ConversionException("Cannot read relationships: " + e.getMessage(), e);
        }
        return Collections.unmodifiableMap(targets);
    }

    /** Names of the parts under {@code word/media} and {@code word/embeddings}, in package order. */
    public List<String> mediaPartNames() throws ConversionException {
        List<String> names = new ArrayList<>();
        try {
            for (PackagePart part : pkg.getParts()) {
                String name = part.getPartName().getName();
                if (MEDIA_FOLDERS.stream().anyMatch(name::startsWith)) {
                    names.add(name);
                }
            }
        } catch (InvalidFormatException e) {
            throw new ConversionException("Cannot list package parts: " + e.getMessage(), e);
        }
        return names;
    }

    public InputStream openPart(String partName) throws ConversionException {
        try {
            PackagePart part = pkg.getPart(PackagingURIHelper.createPartName(partName));
            if (part == null) {
                throw new ConversionException("No such part: " + partName);
            }
            return part.getInputStream();
        } catch (InvalidFormatException | IOException e) {
            throw new ConversionException(
                    "Cannot read part " + partName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves link extensions from the relationship targets, e.g. {@code rId7 -> media/image3.emf}
     * gives {@code emf}. Unknown ids and targets of another media kind use {@code fallback}.
     */
    public ImageExtensionResolver extensionResolver(ImageExtensionResolver fallback)
            throws ConversionException {
        Map<String, String> targets = relationshipTargets();
        return (kind, relationshipId) -> {
            String target = targets.get(relationshipId);
            if (target != null) {
                String ext = MediaKind.extensionOf(target);
                if (MediaKind.forExtension(ext).filter(k -> k == kind).isPresent()) {
                    return ext;
                }
            }
            return fallback.extensionFor(kind, relationshipId);
        };
    }

    @Override
    public void close() {
        pkg.revert();
    }
}

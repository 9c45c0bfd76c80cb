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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import net.boyechko.word2md.content.ContentExtractor;
import net.boyechko.word2md.document.DocTree;
import net.boyechko.word2md.document.DocTreeBuilder;
import net.boyechko.word2md.document.DocxPackage;
import net.boyechko.word2md.math.MathTranspiler;
import net.boyechko.word2md.media.ImageCounters;
import net.boyechko.word2md.media.ImageExtensionResolver;
import net.boyechko.word2md.media.ImageLinks;
import net.boyechko.word2md.media.MediaExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Orchestrates the conversion of one Word document to Markdown. */
public class ConversionService {
    private static final Logger logger = LoggerFactory.getLogger(ConversionService.class);

    private static final String DOCX_SUFFIX = ".docx";
    private static final String XML_SUFFIX = ".xml";
    private static final String MARKDOWN_SUFFIX = ".md";

    private final ConversionConfig config;
    private final ProcessingListener listener;
    private final boolean extractMedia;
    private final Path imagesDir;

    public static class ConversionServiceBuilder {
        private ConversionConfig config;
        private ProcessingListener listener;
        private Boolean extractMedia;
        private Path imagesDir;

        public ConversionServiceBuilder withConfig(ConversionConfig config) {
            this.config = config;
            return this;
        }

        public ConversionServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        public ConversionServiceBuilder withMediaExtraction(boolean extractMedia) {
            this.extractMedia = extractMedia;
            return this;
        }

        public ConversionServiceBuilder withImagesDir(Path imagesDir) {
            this.imagesDir = imagesDir;
            return this;
        }

        public ConversionService build() {
            if (listener == null) {
                throw new IllegalStateException(
                        "ProcessingListener must be provided via withListener(...) before building ConversionService");
            }
            if (config == null) {
                config = ConversionConfig.loadDefault();
            }
            return new ConversionService(this);
        }
    }

    private ConversionService(ConversionServiceBuilder builder) {
        this.config = builder.config;
        this.listener = builder.listener;
        this.extractMedia =
                builder.extractMedia != null ? builder.extractMedia : config.extract_media;
        this.imagesDir = builder.imagesDir != null ? builder.imagesDir : config.imagesDir();
    }

    /** Converts {@code input} and writes the Markdown to the configured Markdown directory. */
    public ConversionResult convert(Path input) throws ConversionException {
        return convert(input, defaultOutputPath(input));
    }

    public Path defaultOutputPath(Path input) {
        return config.markdownDir().resolve(stem(input) + MARKDOWN_SUFFIX);
    }

    public ConversionResult convert(Path input, Path output) throws ConversionException {
        if (!Files.isRegularFile(input)) {
            throw new ConversionException("Input not found: " + input);
        }
        String name = input.getFileName().toString().toLowerCase(Locale.ROOT);

        ConversionResult converted;
        if (name.endsWith(DOCX_SUFFIX)) {
            converted = convertDocx(input);
        } else if (name.endsWith(XML_SUFFIX)) {
            listener.onPhaseStart("Reading document");
            DocTree tree = DocTreeBuilder.parse(input);
            listener.onVerboseOutput("Parsed " + tree.size() + " elements");
            converted = convertTree(tree, stem(input), config.defaultExtensions(), List.of());
        } else {
            throw new ConversionException(
                    "Unsupported input " + input + " (expected .docx or .xml)");
        }

        write(converted.markdown(), output);
        listener.onSuccess("Wrote " + output);
        listener.onSummary(converted.stats());
        return new ConversionResult(
                converted.markdown(), output, converted.stats(), converted.extractedMedia());
    }

    private ConversionResult convertDocx(Path input) throws ConversionException {
        try (DocxPackage docx = DocxPackage.open(input)) {
            listener.onPhaseStart("Reading document");
            DocTree tree = docx.readDocumentTree();
            listener.onVerboseOutput("Parsed " + tree.size() + " elements");

            List<Path> media = List.of();
            if (extractMedia) {
                listener.onPhaseStart("Extracting media");
                media = new MediaExtractor(config.mediaLayout()).extract(docx, imagesDir);
                listener.onInfo("Extracted " + media.size() + " media files");
                for (Path path : media) {
                    listener.onVerboseOutput(path.toString());
                }
            }

            ImageExtensionResolver resolver = docx.extensionResolver(config.defaultExtensions());
            return convertTree(tree, docx.documentName(), resolver, media);
        }
    }

    /**
     * Assembles a parsed tree with fresh image counters. Nothing is written and no summary is
     * reported.
     */
    public ConversionResult convertTree(
            DocTree tree,
            String documentName,
            ImageExtensionResolver resolver,
            List<Path> extractedMedia) {
        listener.onPhaseStart("Converting");
        ContentExtractor extractor =
                new ContentExtractor(new MathTranspiler(), config.default_image_name);
        ImageLinks links =
                new ImageLinks(documentName, config.mediaLayout(), resolver, new ImageCounters());
        ConversionStats stats = new ConversionStats();

        String markdown = new DocumentAssembler(extractor).assemble(tree.root(), links, stats);

        if (stats.failedNodes() > 0) {
            listener.onWarning(stats.failedNodes() + " block(s) could not be converted");
        }
        logger.info("Converted {}: {}", documentName, stats);
        return new ConversionResult(markdown, null, stats, extractedMedia);
    }

    private static void write(String markdown, Path output) throws ConversionException {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, markdown, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConversionException("Cannot write " + output + ": " + e.getMessage(), e);
        }
    }

    private static String stem(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}

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
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.word2md.media.ImageExtensionResolver;
import net.boyechko.word2md.media.MediaLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/** Conversion settings, loaded from YAML. Field names follow the YAML keys. */
public final class ConversionConfig {
    private static final String DEFAULT_CONFIG_RESOURCE = "/word2md-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(ConversionConfig.class);

    /** Media directory as referenced from the Markdown file. */
    public String media_root = MediaLayout.DEFAULT.mediaRoot();

    public String raster_dir = MediaLayout.DEFAULT.rasterDir();
    public String vector_dir = MediaLayout.DEFAULT.vectorDir();
    public String binary_dir = MediaLayout.DEFAULT.binaryDir();

    /** Link extensions used when the package does not say otherwise. */
    public String raster_extension = "png";

    public String vector_extension = "wmf";

    public String default_image_name = "Image";

    /** Where extracted media is written on disk. */
    public String images_dir = "Images";

    /** Default directory for Markdown output. */
    public String markdown_dir = "Markdown";

    public boolean extract_media = true;

    public MediaLayout mediaLayout() {
        return new MediaLayout(media_root, raster_dir, vector_dir, binary_dir);
    }

    public ImageExtensionResolver defaultExtensions() {
        return ImageExtensionResolver.fixed(raster_extension, vector_extension);
    }

    public Path imagesDir() {
        return Path.of(images_dir);
    }

    public Path markdownDir() {
        return Path.of(markdown_dir);
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static ConversionConfig fromResource(String resourcePath) {
        try (InputStream in = ConversionConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            ConversionConfig config = load(in);
            logger.debug("Loaded configuration from resource {}", resourcePath);
            return config;
        } catch (IOException | YAMLException e) {
            logger.error("Failed to load configuration {}: {}", resourcePath, e.getMessage());
            throw new IllegalStateException(
                    "Failed to load configuration " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    public static ConversionConfig loadDefault() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    public static ConversionConfig fromFile(Path path) throws ConversionException {
        try (InputStream in = Files.newInputStream(path)) {
            ConversionConfig config = load(in);
            logger.debug("Loaded configuration from {}", path);
            return config;
        } catch (IOException | YAMLException e) {
            throw new ConversionException(
                    "Cannot load configuration " + path + ": " + e.getMessage(), e);
        }
    }

    private static ConversionConfig load(InputStream in) {
        Yaml yaml = new Yaml(new Constructor(ConversionConfig.class, new LoaderOptions()));
        ConversionConfig config = yaml.load(in);
        if (config == null) {
            config = new ConversionConfig();
        }
        for (String warning : config.validate()) {
            logger.warn("Configuration: {}", warning);
        }
        return config;
    }

    /** Replaces blank settings with built-in defaults and reports each replacement. */
    public List<String> validate() {
        ConversionConfig defaults = new ConversionConfig();
        List<String> warnings = new ArrayList<>();
        media_root = orDefault("media_root", media_root, defaults.media_root, warnings);
        raster_dir = orDefault("raster_dir", raster_dir, defaults.raster_dir, warnings);
        vector_dir = orDefault("vector_dir", vector_dir, defaults.vector_dir, warnings);
        binary_dir = orDefault("binary_dir", binary_dir, defaults.binary_dir, warnings);
        raster_extension =
                orDefault("raster_extension", raster_extension, defaults.raster_extension, warnings);
        vector_extension =
                orDefault("vector_extension", vector_extension, defaults.vector_extension, warnings);
        default_image_name =
                orDefault(
                        "default_image_name",
                        default_image_name,
                        defaults.default_image_name,
                        warnings);
        images_dir = orDefault("images_dir", images_dir, defaults.images_dir, warnings);
        markdown_dir = orDefault("markdown_dir", markdown_dir, defaults.markdown_dir, warnings);
        return warnings;
    }

    private static String orDefault(
            String key, String value, String fallback, List<String> warnings) {
        if (value == null || value.isBlank()) {
            warnings.add(key + " is empty, using \"" + fallback + "\"");
            return fallback;
        }
        return value;
    }
}

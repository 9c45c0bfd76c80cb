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
package net.boyechko.word2md.ui.cli;

import ch.qos.logback.classic.LoggerContext;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import net.boyechko.word2md.core.ConversionConfig;
import net.boyechko.word2md.core.ConversionException;
import net.boyechko.word2md.core.ConversionResult;
import net.boyechko.word2md.core.ConversionService;
import net.boyechko.word2md.core.ProcessingListener;
import net.boyechko.word2md.core.VerbosityLevel;
import net.boyechko.word2md.document.DocTree;
import net.boyechko.word2md.document.DocTreeBuilder;
import net.boyechko.word2md.document.DocxPackage;
import net.boyechko.word2md.ui.LoggingListener;
import net.boyechko.word2md.ui.ProcessingReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Word2MdCLI {
    private static final String MARKDOWN_SUFFIX = ".md";

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputPath,
            Path configPath,
            Path imagesDir,
            boolean extractMedia,
            boolean dumpTree,
            boolean logOutput,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves derived paths. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputPath;
        Path configPath;
        Path imagesDir;
        boolean extractMedia = true;
        boolean dumpTree;
        boolean logOutput;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            String name = inputPath.getFileName().toString().toLowerCase(Locale.ROOT);
            if (!name.endsWith(".docx") && !name.endsWith(".xml")) {
                throw new CLIException("Expected a .docx or .xml file: " + inputPath);
            }
            if (configPath != null && !Files.isRegularFile(configPath)) {
                throw new CLIException("Configuration file not found: " + configPath);
            }
            if (outputPath != null && Files.isDirectory(outputPath)) {
                String baseName = inputPath.getFileName().toString().replaceFirst("[.][^.]+$", "");
                outputPath = outputPath.resolve(baseName + MARKDOWN_SUFFIX);
            }
            return new CLIConfig(
                    inputPath,
                    outputPath,
                    configPath,
                    imagesDir,
                    extractMedia,
                    dumpTree,
                    logOutput,
                    verbosity);
        }
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /** Runs the command line and returns the process exit status. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (isHelpRequested(args)) {
                out.println(usageMessage());
                return 0;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger().info(
                            "Starting conversion of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            if (config.dumpTree()) {
                return dumpTree(config, out, err);
            }
            return processFile(config, out, err);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--images-dir=")) {
                b.imagesDir = Paths.get(args[i].substring("--images-dir=".length()));
            } else if (args[i].startsWith("--config=")) {
                b.configPath = Paths.get(args[i].substring("--config=".length()));
            } else {
                switch (args[i]) {
                    case "--images-dir" -> {
                        if (i + 1 < args.length) {
                            b.imagesDir = Paths.get(args[++i]);
                        } else {
                            throw new CLIException("Directory not specified after --images-dir");
                        }
                    }
                    case "-c", "--config" -> {
                        if (i + 1 < args.length) {
                            b.configPath = Paths.get(args[++i]);
                        } else {
                            throw new CLIException("File not specified after " + args[i]);
                        }
                    }
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "--no-media" -> b.extractMedia = false;
                    case "--dump-tree" -> b.dumpTree = true;
                    case "--log" -> b.logOutput = true;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(args[i]);
                        } else if (b.outputPath == null) {
                            b.outputPath = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Too many file arguments: " + args[i]);
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx) {
            ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(verbosity.logbackLevel());
        }
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(Word2MdCLI.class);
        }
        return logger;
    }

    private static int processFile(CLIConfig config, PrintStream out, PrintStream err) {
        ProcessingReporter reporter = null;
        ProcessingListener listener;
        if (config.logOutput()) {
            listener = LoggingListener.withConsoleOutput();
        } else {
            reporter = new ProcessingReporter(out, config.verbosity());
            listener = reporter;
        }

        try {
            ConversionConfig conversionConfig =
                    config.configPath() != null
                            ? ConversionConfig.fromFile(config.configPath())
                            : ConversionConfig.loadDefault();

            ConversionService.ConversionServiceBuilder builder =
                    new ConversionService.ConversionServiceBuilder()
                            .withConfig(conversionConfig)
                            .withListener(listener);
            if (!config.extractMedia()) {
                builder.withMediaExtraction(false);
            }
            if (config.imagesDir() != null) {
                builder.withImagesDir(config.imagesDir());
            }
            ConversionService service = builder.build();

            ConversionResult result =
                    config.outputPath() != null
                            ? service.convert(config.inputPath(), config.outputPath())
                            : service.convert(config.inputPath());
            logger().info("Markdown written to {}", result.outputPath());
            if (result.hasFailures()) {
                logger().warn("{} block(s) were skipped", result.stats().failedNodes());
            }
            return 0;
        } catch (ConversionException e) {
            listener.onError("Conversion failed: " + e.getMessage());
            err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        } finally {
            if (reporter != null) {
                reporter.detach();
            }
        }
    }

    /** Prints the document's element tree and exits. */
    private static int dumpTree(CLIConfig config, PrintStream out, PrintStream err) {
        String name = config.inputPath().getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            DocTree tree;
            if (name.endsWith(".docx")) {
                try (DocxPackage docx = DocxPackage.open(config.inputPath())) {
                    tree = docx.readDocumentTree();
                }
            } else {
                tree = DocTreeBuilder.parse(config.inputPath());
            }
            out.print(tree.toIndentedTreeString());
            return 0;
        } catch (ConversionException e) {
            err.println("✗ Failed to read document: " + e.getMessage());
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: word2md [-q|-v|-vv] [--no-media] [--images-dir=<dir>] [--config=<file>] [--log] [--dump-tree] <input.docx|input.xml> [<output.md>]\n"
                + "  -h, --help          Show this help message\n"
                + "  -q, --quiet         Only show errors\n"
                + "  -v, --verbose       Show detailed processing information\n"
                + "  -vv, --debug        Show all debug information\n"
                + "  --no-media          Do not extract embedded images\n"
                + "  --images-dir=<dir>  Write extracted images under <dir>\n"
                + "  -c, --config=<file> Load settings from a YAML file\n"
                + "  --log               Report progress as log lines instead of boxes\n"
                + "  --dump-tree         Print the document element tree and exit\n"
                + "Without <output.md>, the Markdown goes to the configured markdown_dir.\n"
                + "Examples:\n"
                + "  word2md report.docx\n"
                + "  word2md -v --images-dir=out/Images report.docx out/Markdown/report.md\n"
                + "  word2md --dump-tree report.docx";
    }
}

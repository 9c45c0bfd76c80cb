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

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.word2md.DocxTestBase;
import net.boyechko.word2md.core.VerbosityLevel;
import net.boyechko.word2md.ui.cli.Word2MdCLI.CLIConfig;
import net.boyechko.word2md.ui.cli.Word2MdCLI.CLIException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class Word2MdCLITest extends DocxTestBase {

    private Path input;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void writeInput() throws Exception {
        input = tempDir.resolve("memo.xml");
        Files.writeString(
                input,
                withNamespaces(
                        "<w:document><w:body><w:p>" + run("Hi") + "</w:p></w:body></w:document>"));
    }

    private int cli(String... args) {
        return Word2MdCLI.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void parsesFlagsAndPositionalPaths() throws Exception {
        Path output = tempDir.resolve("memo.md");

        CLIConfig config =
                Word2MdCLI.parseArguments(
                        new String[] {
                            "-v", "--no-media", "--images-dir=imgs", "--log", input.toString(), output.toString()
                        });

        assertEquals(input, config.inputPath());
        assertEquals(output, config.outputPath());
        assertEquals(Path.of("imgs"), config.imagesDir());
        assertEquals(VerbosityLevel.VERBOSE, config.verbosity());
        assertFalse(config.extractMedia());
        assertTrue(config.logOutput());
        assertFalse(config.dumpTree());
        assertNull(config.configPath());
    }

    @Test
    void defaultsApplyWithoutFlags() throws Exception {
        CLIConfig config = Word2MdCLI.parseArguments(new String[] {input.toString()});

        assertEquals(VerbosityLevel.NORMAL, config.verbosity());
        assertTrue(config.extractMedia());
        assertNull(config.outputPath());
        assertNull(config.imagesDir());
    }

    @Test
    void separateOptionValuesAreAccepted() throws Exception {
        Path yaml = tempDir.resolve("settings.yaml");
        Files.writeString(yaml, "raster_dir: IMG\n");

        CLIConfig config =
                Word2MdCLI.parseArguments(
                        new String[] {"--images-dir", "pics", "-c", yaml.toString(), input.toString()});

        assertEquals(Path.of("pics"), config.imagesDir());
        assertEquals(yaml, config.configPath());
    }

    @Test
    void outputDirectoryResolvesToMarkdownFile() throws Exception {
        CLIConfig config =
                Word2MdCLI.parseArguments(new String[] {input.toString(), tempDir.toString()});

        assertEquals(tempDir.resolve("memo.md"), config.outputPath());
    }

    @Test
    void invalidArgumentsAreRejected() throws Exception {
        Path text = tempDir.resolve("memo.txt");
        Files.writeString(text, "x");

        assertThrows(CLIException.class, () -> Word2MdCLI.parseArguments(new String[0]));
        assertThrows(
                CLIException.class,
                () -> Word2MdCLI.parseArguments(new String[] {tempDir.resolve("none.docx").toString()}));
        assertThrows(
                CLIException.class, () -> Word2MdCLI.parseArguments(new String[] {text.toString()}));
        assertThrows(
                CLIException.class,
                () -> Word2MdCLI.parseArguments(new String[] {"--bogus", input.toString()}));
        assertThrows(
                CLIException.class,
                () -> Word2MdCLI.parseArguments(new String[] {input.toString(), "a.md", "b.md"}));
        assertThrows(
                CLIException.class,
                () -> Word2MdCLI.parseArguments(new String[] {input.toString(), "--images-dir"}));
        assertThrows(
                CLIException.class,
                () -> Word2MdCLI.parseArguments(new String[] {"--config=absent.yaml", input.toString()}));
    }

    @Test
    void helpPrintsUsage() {
        assertEquals(0, cli("--help"));
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("Usage: word2md"));
    }

    @Test
    void errorsExitWithStatusOne() {
        assertEquals(1, cli());
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Error: No input file specified"));
    }

    @Test
    void convertsToGivenOutput() throws Exception {
        Path output = tempDir.resolve("md").resolve("memo.md");

        assertEquals(0, cli("-q", input.toString(), output.toString()));
        assertEquals("Hi", Files.readString(output));
    }

    @Test
    void conversionFailureExitsWithStatusOne() throws Exception {
        Files.writeString(input, "<broken");

        assertEquals(1, cli("-q", input.toString(), tempDir.resolve("memo.md").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Conversion failed"));
    }

    @Test
    void dumpTreePrintsElements() {
        assertEquals(0, cli("--dump-tree", input.toString()));

        String tree = out.toString(StandardCharsets.UTF_8);
        assertTrue(tree.startsWith("w:document\n  w:body\n    w:p\n      w:r\n"));
        assertTrue(tree.contains("w:t xml:space=\"preserve\" \"Hi\""));
    }
}

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
package net.boyechko.word2md;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Map;
import net.boyechko.word2md.core.ConversionException;
import net.boyechko.word2md.document.DocNode;
import net.boyechko.word2md.document.DocTree;
import net.boyechko.word2md.document.DocTreeBuilder;
import net.boyechko.word2md.document.Namespaces;
import net.boyechko.word2md.media.ImageCounters;
import net.boyechko.word2md.media.ImageExtensionResolver;
import net.boyechko.word2md.media.ImageLinks;
import net.boyechko.word2md.media.MediaLayout;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.io.TempDir;

/**
 * Base for tests that build document trees from WordprocessingML fragments. Fragments use the
 * conventional prefixes ({@code w:}, {@code m:}, {@code wp:}, {@code a:}, {@code pic:}, {@code
 * r:}, {@code v:}, {@code o:}) without declaring them.
 */
public abstract class DocxTestBase {
    protected static final String DOC_NAME = "doc";

    /** A 1x1 transparent PNG. */
    protected static final byte[] TINY_PNG =
            Base64.getDecoder()
                    .decode(
                            "iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAYAAAAfFcSJAAAADUlEQVR42mNkYPhfDwAChwGA60e6kgAAAABJRU5ErkJggg==");

    @TempDir protected Path tempDir;

    // ── Tree building ───────────────────────────────────────────────

    /** Parses a fragment, declaring the known namespace prefixes on its root element. */
    protected static DocTree tree(String xml) {
        try {
            byte[] bytes = withNamespaces(xml).getBytes(StandardCharsets.UTF_8);
            return DocTreeBuilder.parse(new ByteArrayInputStream(bytes));
        } catch (ConversionException e) {
            throw new IllegalArgumentException("Bad test fragment: " + xml, e);
        }
    }

    protected static DocNode node(String xml) {
        return tree(xml).root();
    }

    protected static DocNode paragraph(String innerXml) {
        return node("<w:p>" + innerXml + "</w:p>");
    }

    protected static DocNode document(String bodyXml) {
        return node("<w:document><w:body>" + bodyXml + "</w:body></w:document>");
    }

    protected static String withNamespaces(String xml) {
        StringBuilder decls = new StringBuilder();
        for (Map.Entry<String, String> ns : Namespaces.declarations().entrySet()) {
            decls.append(" xmlns:").append(ns.getKey()).append("=\"").append(ns.getValue()).append('"');
        }
        int start = xml.indexOf('<');
        while (xml.startsWith("<?", start)) {
            start = xml.indexOf('<', xml.indexOf("?>", start));
        }
        int end = start + 1;
        while (end < xml.length()
                && !Character.isWhitespace(xml.charAt(end))
                && xml.charAt(end) != '>'
                && xml.charAt(end) != '/') {
            end++;
        }
        return xml.substring(0, end) + decls + xml.substring(end);
    }

    // ── Fragment helpers ────────────────────────────────────────────

    protected static String run(String text) {
        return "<w:r><w:t xml:space=\"preserve\">" + text + "</w:t></w:r>";
    }

    protected static String styledRun(String runProperties, String text) {
        return "<w:r><w:rPr>"
                + runProperties
                + "</w:rPr><w:t xml:space=\"preserve\">"
                + text
                + "</w:t></w:r>";
    }

    protected static String superscriptRun(String text) {
        return styledRun("<w:vertAlign w:val=\"superscript\"/>", text);
    }

    protected static String subscriptRun(String text) {
        return styledRun("<w:vertAlign w:val=\"subscript\"/>", text);
    }

    protected static String mathRun(String text) {
        return "<m:r><m:t>" + text + "</m:t></m:r>";
    }

    protected static String oMath(String inner) {
        return "<m:oMath>" + inner + "</m:oMath>";
    }

    protected static String drawing(String relationshipId, String name) {
        String docPr =
                name != null
                        ? "<wp:docPr id=\"1\" name=\"" + name + "\"/>"
                        : "<wp:docPr id=\"1\"/>";
        return "<w:r><w:drawing><wp:inline>"
                + docPr
                + "<a:graphic><a:graphicData><pic:pic><pic:blipFill><a:blip r:embed=\""
                + relationshipId
                + "\"/></pic:blipFill></pic:pic></a:graphicData></a:graphic>"
                + "</wp:inline></w:drawing></w:r>";
    }

    protected static String imageData(String relationshipId, String title) {
        return "<w:r><w:object><v:shape><v:imagedata r:id=\""
                + relationshipId
                + "\" o:title=\""
                + title
                + "\"/></v:shape></w:object></w:r>";
    }

    protected static ImageLinks links() {
        return links(new ImageCounters());
    }

    protected static ImageLinks links(ImageCounters counters) {
        return new ImageLinks(
                DOC_NAME, MediaLayout.DEFAULT, ImageExtensionResolver.fixed("png", "wmf"), counters);
    }

    // ── Real packages ───────────────────────────────────────────────

    /** Callback for adding content to a test document via the POI XWPF API. */
    @FunctionalInterface
    protected interface TestDocxContent {
        void addTo(XWPFDocument document) throws Exception;
    }

    /** Writes a {@code .docx} built with POI to {@code tempDir/fileName}. */
    protected final Path createTestDocx(String fileName, TestDocxContent content) throws Exception {
        Path path = tempDir.resolve(fileName);
        try (XWPFDocument document = new XWPFDocument();
                OutputStream out = Files.newOutputStream(path)) {
            content.addTo(document);
            document.write(out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write test document: " + path, e);
        }
        return path;
    }
}

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

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.word2md.DocxTestBase;
import net.boyechko.word2md.core.ConversionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DocTreeBuilderTest extends DocxTestBase {

    @Test
    void indicesFollowDocumentOrder() {
        DocTree tree = tree("<w:p><w:r><w:t>a</w:t></w:r><w:r><w:t>b</w:t></w:r></w:p>");

        assertEquals(5, tree.size());
        for (int i = 0; i < tree.size(); i++) {
            assertEquals(i, tree.node(i).index());
        }
        assertSame(tree.root(), tree.node(0));
        assertEquals("b", tree.node(4).text());
    }

    @ParameterizedTest
    @CsvSource({
        "<w:p/>, PARAGRAPH",
        "<w:cr/>, BREAK",
        "<m:oMath/>, MATH",
        "<m:sSupSub/>, SUB_SUPERSCRIPT",
        "<m:fPr/>, MATH_PROPERTIES",
        "<m:box/>, OTHER",
        "<w:sdt/>, OTHER",
        "<wp:docPr/>, DOC_PROPERTIES",
        "<a:blip/>, BLIP",
        "<v:imagedata/>, IMAGE_DATA",
        "<o:OLEObject/>, OTHER"
    })
    void elementsAreClassifiedByQualifiedName(String xml, NodeKind expected) {
        assertEquals(expected, node(xml).kind());
    }

    @Test
    void sameLocalNameInOtherNamespaceIsNotWordParagraph() {
        DocNode node = node("<x:p xmlns:x=\"urn:example\"/>");

        assertEquals(NodeKind.OTHER, node.kind());
        assertEquals("{urn:example}p", node.tag().toPrefixedString());
    }

    @Test
    void attributesKeepNamespacesAndDropDeclarations() {
        DocNode imageData = node("<v:imagedata r:id=\"rId4\" o:title=\"Eq\" style=\"x\"/>");

        assertEquals(3, imageData.attributes().size());
        assertEquals("rId4", imageData.attribute(Namespaces.r("id")));
        assertEquals("Eq", imageData.attribute(Namespaces.o("title")));
        assertEquals("x", imageData.attribute(QName.unqualified("style")));
    }

    @Test
    void valReadsWordOrMathNamespace() {
        assertEquals("Heading1", node("<w:pStyle w:val=\"Heading1\"/>").val());
        assertEquals("∑", node("<m:chr m:val=\"∑\"/>").val());
        assertNull(node("<w:u/>").val());
    }

    @Test
    void textIsDirectCharacterContentOnly() {
        DocNode run = node("<w:r><w:t xml:space=\"preserve\"> a <![CDATA[<b>]]></w:t></w:r>");

        assertNull(run.text());
        assertEquals("", run.textOrEmpty());
        assertEquals(" a <b>", run.children().get(0).text());
    }

    @Test
    void indentedTreeShowsAttributesAndText() {
        DocTree tree = tree("<w:p><w:pPr><w:pStyle w:val=\"Title\"/></w:pPr><w:r><w:t>Hi</w:t></w:r></w:p>");

        assertEquals(
                "w:p\n  w:pPr\n    w:pStyle w:val=\"Title\"\n  w:r\n    w:t \"Hi\"\n",
                tree.toIndentedTreeString());
    }

    @Test
    void malformedXmlIsRejected() {
        byte[] bytes = "<w:p><w:r></w:p>".getBytes(StandardCharsets.UTF_8);

        ConversionException e =
                assertThrows(
                        ConversionException.class,
                        () -> DocTreeBuilder.parse(new ByteArrayInputStream(bytes)));
        assertTrue(e.getMessage().startsWith("Malformed document XML"));
    }

    @Test
    void doctypeIsRejected() {
        String xml = "<!DOCTYPE p [<!ENTITY x \"y\">]><p>&x;</p>";

        assertThrows(
                ConversionException.class,
                () ->
                        DocTreeBuilder.parse(
                                new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void missingFileIsReported() {
        Path missing = tempDir.resolve("missing.xml");

        assertThrows(ConversionException.class, () -> DocTreeBuilder.parse(missing));
    }

    @Test
    void parsesFromPath() throws Exception {
        Path xml = tempDir.resolve("document.xml");
        Files.writeString(xml, withNamespaces("<w:document><w:body/></w:document>"));

        DocTree tree = DocTreeBuilder.parse(xml);

        assertEquals(NodeKind.BODY, tree.root().children().get(0).kind());
    }
}

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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import net.boyechko.word2md.core.ConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/** Parses WordprocessingML XML into an indexed {@link DocTree}. */
public final class DocTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(DocTreeBuilder.class);

    private static final String XMLNS_URI = "http://www.w3.org/2000/xmlns/";

    private final List<DocNode> nodes = new ArrayList<>();
    private int nextIndex;

    private DocTreeBuilder() {}

    public static DocTree parse(Path xmlPath) throws ConversionException {
        try (InputStream in = Files.newInputStream(xmlPath)) {
            return parse(in);
        } catch (IOException e) {
            throw new ConversionException("Cannot read " + xmlPath + ": " + e.getMessage(), e);
        }
    }

    public static DocTree parse(InputStream in) throws ConversionException {
        Document dom;
        try {
            dom = newDocumentBuilder().parse(in);
        } catch (SAXException e) {
            throw new ConversionException("Malformed document XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConversionException("Cannot read document XML: " + e.getMessage(), e);
        }
        return fromElement(dom.getDocumentElement());
    }

    /** Copies a namespace-aware DOM element and its descendants into a new tree. */
    public static DocTree fromElement(Element rootElement) {
        DocTreeBuilder builder = new DocTreeBuilder();
        DocNode root = builder.build(rootElement);
        builder.nodes.sort((a, b) -> Integer.compare(a.index(), b.index()));
        logger.debug("Built document tree with {} nodes", builder.nodes.size());
        return new DocTree(root, builder.nodes);
    }

    private DocNode build(Element element) {
        int index = nextIndex++;
        QName tag = new QName(element.getNamespaceURI(), localNameOf(element));

        Map<QName, String> attributes = new LinkedHashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            if (XMLNS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            attributes.put(new QName(attr.getNamespaceURI(), localNameOf(attr)), attr.getValue());
        }

        List<DocNode> children = new ArrayList<>();
        StringBuilder text = null;
        NodeList kids = element.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            Node kid = kids.item(i);
            switch (kid.getNodeType()) {
                case Node.ELEMENT_NODE -> children.add(build((Element) kid));
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> {
                    if (text == null) {
                        text = new StringBuilder();
                    }
                    text.append(kid.getNodeValue());
                }
                default -> {}
            }
        }

        DocNode node =
                new DocNode(index, tag, attributes, children, text != null ? text.toString() : null);
        nodes.add(node);
        return node;
    }

    private static String localNameOf(Node node) {
        String local = node.getLocalName();
        return local != null ? local : node.getNodeName();
    }

    private static DocumentBuilder newDocumentBuilder() throws ConversionException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new ConversionException("XML parser unavailable: " + e.getMessage(), e);
        }
    }
}

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One element of a parsed document tree. Nodes are immutable and owned by a {@link DocTree}, which
 * assigns each a stable index in document order.
 */
public final class DocNode {
    private final int index;
    private final QName tag;
    private final NodeKind kind;
    private final Map<QName, String> attributes;
    private final List<DocNode> children;
    private final String text;

    DocNode(
            int index,
            QName tag,
            Map<QName, String> attributes,
            List<DocNode> children,
            String text) {
        this.index = index;
        this.tag = tag;
        this.kind = NodeKind.classify(tag);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.children = List.copyOf(children);
        this.text = text;
    }

    /** Position of this node in pre-order traversal of its tree (0 = root). */
    public int index() {
        return index;
    }

    public QName tag() {
        return tag;
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean is(NodeKind k) {
        return kind == k;
    }

    public Map<QName, String> attributes() {
        return attributes;
    }

    public String attribute(QName name) {
        return attributes.get(name);
    }

    /** Shorthand for the ubiquitous {@code w:val} / {@code m:val} attribute. */
    public String val() {
        String v = attributes.get(Namespaces.w("val"));
        return v != null ? v : attributes.get(Namespaces.m("val"));
    }

    public List<DocNode> children() {
        return children;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /** Direct character content of this element, or null if it has none. */
    public String text() {
        return text;
    }

    public String textOrEmpty() {
        return text != null ? text : "";
    }

    @Override
    public String toString() {
        return tag.toPrefixedString() + "[" + index + "]";
    }
}

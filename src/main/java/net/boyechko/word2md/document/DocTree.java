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

import java.util.List;
import java.util.Map;

/** Arena holding every node of one parsed document, addressable by {@link DocNode#index()}. */
public final class DocTree {
    private static final int MAX_TEXT_PREVIEW = 40;

    private final DocNode root;
    private final List<DocNode> nodes;

    DocTree(DocNode root, List<DocNode> nodes) {
        this.root = root;
        this.nodes = List.copyOf(nodes);
    }

    public DocNode root() {
        return root;
    }

    public DocNode node(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    public String toIndentedTreeString() {
        return toIndentedTreeString(root);
    }

    /** Renders the subtree as one element per line, indented by depth, with text previews. */
    public static String toIndentedTreeString(DocNode node) {
        StringBuilder sb = new StringBuilder();
        appendIndentedTree(sb, node, 0);
        return sb.toString();
    }

    private static void appendIndentedTree(StringBuilder sb, DocNode node, int depth) {
        sb.append("  ".repeat(depth));
        sb.append(node.tag().toPrefixedString());
        for (Map.Entry<QName, String> attr : node.attributes().entrySet()) {
            sb.append(' ')
                    .append(attr.getKey().toPrefixedString())
                    .append("=\"")
                    .append(attr.getValue())
                    .append('"');
        }
        String text = node.text();
        if (text != null && !text.isBlank()) {
            sb.append(" \"").append(preview(text)).append('"');
        }
        sb.append('\n');
        for (DocNode kid : node.children()) {
            appendIndentedTree(sb, kid, depth + 1);
        }
    }

    private static String preview(String text) {
        String oneLine = text.replace('\n', ' ');
        if (oneLine.length() <= MAX_TEXT_PREVIEW) {
            return oneLine;
        }
        return oneLine.substring(0, MAX_TEXT_PREVIEW) + "...";
    }
}

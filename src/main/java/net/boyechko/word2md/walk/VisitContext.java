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
package net.boyechko.word2md.walk;

import net.boyechko.word2md.document.DocNode;
import net.boyechko.word2md.document.NodeKind;

/**
 * Immutable context passed to visitors during traversal.
 *
 * @param node the node being visited
 * @param parent the node's parent within the walked subtree, or null at the walk root
 * @param path slash-separated tag path from the walk root, e.g. {@code /w:p[3]/w:r[5]}
 * @param depth depth below the walk root (0 = the root itself)
 */
public record VisitContext(DocNode node, DocNode parent, String path, int depth) {

    public NodeKind kind() {
        return node.kind();
    }

    public boolean hasKind(NodeKind kind) {
        return node.kind() == kind;
    }
}

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

import java.util.BitSet;
import net.boyechko.word2md.document.DocNode;

/** Tracks which nodes of one tree have been processed, keyed by node index. */
public final class VisitedSet {
    private final BitSet visited = new BitSet();

    /**
     * Marks a node as visited.
     *
     * @return true if the node had not been visited before
     */
    public boolean markVisited(DocNode node) {
        if (visited.get(node.index())) {
            return false;
        }
        visited.set(node.index());
        return true;
    }

    public boolean isVisited(DocNode node) {
        return visited.get(node.index());
    }

    public int size() {
        return visited.cardinality();
    }

    public void clear() {
        visited.clear();
    }
}

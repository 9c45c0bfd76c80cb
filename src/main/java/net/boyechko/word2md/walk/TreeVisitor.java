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

/** Visitor interface for document tree traversal. */
public interface TreeVisitor {

    String name();

    /**
     * Called when the walker reaches a node, before its children.
     *
     * @return false to keep the walker out of this node's children
     */
    default boolean enterNode(VisitContext ctx) {
        return true;
    }

    default void leaveNode(VisitContext ctx) {}
}

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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import net.boyechko.word2md.document.DocNode;
import net.boyechko.word2md.document.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a document subtree depth-first in pre-order, invoking every registered visitor at each
 * node. With a {@link VisitedSet}, a node already visited in the same set is skipped along with
 * its subtree.
 */
public class TreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(TreeWalker.class);

    private final List<TreeVisitor> visitors = new ArrayList<>();
    private final List<RuntimeException> failures = new ArrayList<>();

    public TreeWalker addVisitor(TreeVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    /** Visitor exceptions caught during walks, in the order they occurred. */
    public List<RuntimeException> failures() {
        return failures;
    }

    public void walk(DocNode root) {
        walk(root, new VisitedSet());
    }

    public void walk(DocNode root, VisitedSet visited) {
        walkNode(root, null, "", 0, visited);
    }

    private void walkNode(
            DocNode node, DocNode parent, String parentPath, int depth, VisitedSet visited) {
        if (!visited.markVisited(node)) {
            return;
        }

        VisitContext ctx =
                new VisitContext(
                        node,
                        parent,
                        parentPath + "/" + node.tag().toPrefixedString() + "[" + node.index() + "]",
                        depth);

        boolean continueToChildren = true;
        for (TreeVisitor visitor : visitors) {
            try {
                if (!visitor.enterNode(ctx)) {
                    continueToChildren = false;
                }
            } catch (RuntimeException e) {
                failures.add(e);
                logger.error(
                        "Error in visitor {} at {}: {}", visitor.name(), ctx.path(), e.getMessage());
            }
        }

        if (continueToChildren) {
            for (DocNode child : node.children()) {
                walkNode(child, node, ctx.path(), depth + 1, visited);
            }
        }

        for (TreeVisitor visitor : visitors) {
            try {
                visitor.leaveNode(ctx);
            } catch (RuntimeException e) {
                failures.add(e);
                logger.error(
                        "Error in visitor {} leaving {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }
    }

    /** All descendants of {@code root} (excluding root) of the given kind, in document order. */
    public static List<DocNode> findAll(DocNode root, NodeKind kind) {
        return findAll(root, n -> n.kind() == kind);
    }

    public static List<DocNode> findAll(DocNode root, Predicate<DocNode> matcher) {
        List<DocNode> out = new ArrayList<>();
        collect(root, matcher, out, false);
        return out;
    }

    /**
     * Like {@link #findAll(DocNode, NodeKind)}, but does not look inside a match, so nested
     * occurrences are reported only through their outermost ancestor.
     */
    public static List<DocNode> findOutermost(DocNode root, NodeKind kind) {
        List<DocNode> out = new ArrayList<>();
        collect(root, n -> n.kind() == kind, out, true);
        return out;
    }

    public static DocNode findFirst(DocNode root, NodeKind kind) {
        for (DocNode child : root.children()) {
            if (child.kind() == kind) {
                return child;
            }
            DocNode found = findFirst(child, kind);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    public static DocNode firstChild(DocNode parent, NodeKind kind) {
        if (parent == null) return null;
        for (DocNode child : parent.children()) {
            if (child.kind() == kind) {
                return child;
            }
        }
        return null;
    }

    /** First direct child with the given local name, in any namespace. */
    public static DocNode firstChildNamed(DocNode parent, String localName) {
        if (parent == null) return null;
        for (DocNode child : parent.children()) {
            if (child.tag().hasLocalName(localName)) {
                return child;
            }
        }
        return null;
    }

    public static List<DocNode> children(DocNode parent, NodeKind kind) {
        return parent.children().stream().filter(c -> c.kind() == kind).toList();
    }

    private static void collect(
            DocNode node, Predicate<DocNode> matcher, List<DocNode> out, boolean stopAtMatch) {
        for (DocNode child : node.children()) {
            boolean matched = matcher.test(child);
            if (matched) {
                out.add(child);
            }
            if (!matched || !stopAtMatch) {
                collect(child, matcher, out, stopAtMatch);
            }
        }
    }
}

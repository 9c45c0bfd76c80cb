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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.word2md.DocxTestBase;
import net.boyechko.word2md.document.DocNode;
import net.boyechko.word2md.document.NodeKind;
import org.junit.jupiter.api.Test;

/** Tests for TreeWalker and the visitor infrastructure. */
class TreeWalkerTest extends DocxTestBase {

    private static TreeVisitor recording(List<String> entered, List<String> left) {
        return new TreeVisitor() {
            @Override
            public String name() {
                return "Recording";
            }

            @Override
            public boolean enterNode(VisitContext ctx) {
                entered.add(ctx.path());
                return true;
            }

            @Override
            public void leaveNode(VisitContext ctx) {
                left.add(ctx.node().tag().toPrefixedString());
            }
        };
    }

    @Test
    void walkerVisitsNodesInPreOrderWithPaths() {
        DocNode p = paragraph(run("a") + run("b"));
        List<String> entered = new ArrayList<>();
        List<String> left = new ArrayList<>();

        new TreeWalker().addVisitor(recording(entered, left)).walk(p);

        assertEquals(
                List.of(
                        "/w:p[0]",
                        "/w:p[0]/w:r[1]",
                        "/w:p[0]/w:r[1]/w:t[2]",
                        "/w:p[0]/w:r[3]",
                        "/w:p[0]/w:r[3]/w:t[4]"),
                entered);
        assertEquals(List.of("w:t", "w:r", "w:t", "w:r", "w:p"), left);
    }

    @Test
    void decliningDescentSkipsChildrenButStillLeaves() {
        DocNode p = paragraph(run("a"));
        List<NodeKind> entered = new ArrayList<>();
        List<NodeKind> left = new ArrayList<>();

        TreeVisitor stopAtRuns =
                new TreeVisitor() {
                    @Override
                    public String name() {
                        return "Stop at runs";
                    }

                    @Override
                    public boolean enterNode(VisitContext ctx) {
                        entered.add(ctx.kind());
                        return !ctx.hasKind(NodeKind.RUN);
                    }

                    @Override
                    public void leaveNode(VisitContext ctx) {
                        left.add(ctx.kind());
                    }
                };
        new TreeWalker().addVisitor(stopAtRuns).walk(p);

        assertEquals(List.of(NodeKind.PARAGRAPH, NodeKind.RUN), entered);
        assertEquals(List.of(NodeKind.RUN, NodeKind.PARAGRAPH), left);
    }

    @Test
    void visitedNodesAreSkippedWithTheirSubtrees() {
        DocNode p = paragraph(run("a") + run("b"));
        VisitedSet visited = new VisitedSet();
        assertTrue(visited.markVisited(p.children().get(0)));

        List<String> entered = new ArrayList<>();
        new TreeWalker().addVisitor(recording(entered, new ArrayList<>())).walk(p, visited);

        assertEquals(List.of("/w:p[0]", "/w:p[0]/w:r[3]", "/w:p[0]/w:r[3]/w:t[4]"), entered);
        assertEquals(4, visited.size());
        assertFalse(visited.markVisited(p), "Root was marked during the walk");
    }

    @Test
    void failingVisitorDoesNotStopOtherVisitors() {
        DocNode p = paragraph(run("a"));
        TreeVisitor failing =
                new TreeVisitor() {
                    @Override
                    public String name() {
                        return "Failing";
                    }

                    @Override
                    public boolean enterNode(VisitContext ctx) {
                        throw new IllegalStateException("boom");
                    }
                };
        List<String> entered = new ArrayList<>();

        new TreeWalker()
                .addVisitor(failing)
                .addVisitor(recording(entered, new ArrayList<>()))
                .walk(p);

        assertEquals(3, entered.size(), "Walk should continue past the failing visitor");
    }

    @Test
    void visitorFailuresAreRecorded() {
        DocNode p = paragraph(run("a"));
        TreeWalker walker =
                new TreeWalker()
                        .addVisitor(
                                new TreeVisitor() {
                                    @Override
                                    public String name() {
                                        return "Failing on text";
                                    }

                                    @Override
                                    public boolean enterNode(VisitContext ctx) {
                                        if (ctx.node().is(NodeKind.TEXT)) {
                                            throw new IllegalStateException("bad text");
                                        }
                                        return true;
                                    }
                                });

        walker.walk(p);

        assertEquals(1, walker.failures().size());
        assertEquals("bad text", walker.failures().get(0).getMessage());
    }

    @Test
    void depthAndParentAreReported() {
        DocNode p = paragraph(run("a"));
        List<VisitContext> contexts = new ArrayList<>();
        new TreeWalker()
                .addVisitor(
                        new TreeVisitor() {
                            @Override
                            public String name() {
                                return "Context";
                            }

                            @Override
                            public boolean enterNode(VisitContext ctx) {
                                contexts.add(ctx);
                                return true;
                            }
                        })
                .walk(p);

        assertNull(contexts.get(0).parent());
        assertEquals(0, contexts.get(0).depth());
        assertSame(p, contexts.get(1).parent());
        assertEquals(2, contexts.get(2).depth());
    }

    @Test
    void findAllExcludesRootAndKeepsDocumentOrder() {
        DocNode p = paragraph(run("a") + "<w:hyperlink>" + run("b") + "</w:hyperlink>");

        List<DocNode> runs = TreeWalker.findAll(p, NodeKind.RUN);
        List<DocNode> paragraphs = TreeWalker.findAll(p, NodeKind.PARAGRAPH);

        assertEquals(2, runs.size());
        assertTrue(runs.get(0).index() < runs.get(1).index());
        assertTrue(paragraphs.isEmpty());
    }

    @Test
    void findOutermostDoesNotLookInsideMatches() {
        DocNode r =
                node("<w:r><m:oMath><m:oMath>" + mathRun("x") + "</m:oMath></m:oMath></w:r>");

        assertEquals(1, TreeWalker.findOutermost(r, NodeKind.MATH).size());
        assertEquals(2, TreeWalker.findAll(r, NodeKind.MATH).size());
    }

    @Test
    void childLookupsToleratesMissingParent() {
        assertNull(TreeWalker.firstChild(null, NodeKind.RUN));
        assertNull(TreeWalker.firstChildNamed(null, "e"));

        DocNode frac = node("<m:f><m:num/><m:den/></m:f>");
        assertEquals(NodeKind.DENOMINATOR, TreeWalker.firstChildNamed(frac, "den").kind());
        assertNull(TreeWalker.firstChild(frac, NodeKind.ARGUMENT));
        assertNull(TreeWalker.findFirst(frac, NodeKind.BODY));
    }
}

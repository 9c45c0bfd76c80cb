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
package net.boyechko.word2md.content;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import net.boyechko.word2md.document.DocNode;
import net.boyechko.word2md.document.NodeKind;
import net.boyechko.word2md.math.MathTranspiler;
import net.boyechko.word2md.walk.TreeVisitor;
import net.boyechko.word2md.walk.TreeWalker;
import net.boyechko.word2md.walk.VisitContext;
import net.boyechko.word2md.walk.VisitedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a paragraph subtree into an ordered list of {@link ContentItem}s.
 *
 * <p>Math groups become {@link ContentItem.Math} items wherever they occur. A run yields either the
 * math groups nested inside it or its own text (as a script item when vertically aligned),
 * followed by its drawings and legacy image data. Tables contribute nothing; they are flattened
 * separately.
 */
public class ContentExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ContentExtractor.class);

    public static final String DEFAULT_IMAGE_NAME = "Image";

    private static final Pattern WHITESPACE =
            Pattern.compile("[\\s\\u3000]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final String UNDERLINE_FILL = "_";
    private static final Predicate<DocNode> RENDERABLE =
            n -> n.is(NodeKind.TEXT) || n.is(NodeKind.BLIP) || n.is(NodeKind.IMAGE_DATA);

    private final MathTranspiler transpiler;
    private final String defaultImageName;

    public ContentExtractor() {
        this(new MathTranspiler(), DEFAULT_IMAGE_NAME);
    }

    public ContentExtractor(MathTranspiler transpiler, String defaultImageName) {
        this.transpiler = transpiler;
        this.defaultImageName = defaultImageName;
    }

    public MathTranspiler transpiler() {
        return transpiler;
    }

    /**
     * Extracts the items of one paragraph, before script merging. A failure while visiting any node
     * of the paragraph is rethrown, with later failures attached as suppressed.
     */
    public List<ContentItem> extract(DocNode paragraph) {
        ParagraphVisitor visitor = new ParagraphVisitor();
        TreeWalker walker = new TreeWalker().addVisitor(visitor);
        walker.walk(paragraph, visitor.visited);
        if (!walker.failures().isEmpty()) {
            RuntimeException first = walker.failures().get(0);
            walker.failures().stream().skip(1).forEach(first::addSuppressed);
            throw first;
        }
        logger.debug("Extracted {} items from {}", visitor.items.size(), paragraph);
        return visitor.items;
    }

    /** Extracts the items of one paragraph and folds trailing scripts into their base text. */
    public List<ContentItem> extractMerged(DocNode paragraph) {
        return ScriptMerger.merge(extract(paragraph));
    }

    private final class ParagraphVisitor implements TreeVisitor {
        private final List<ContentItem> items = new ArrayList<>();
        private final VisitedSet visited = new VisitedSet();

        @Override
        public String name() {
            return "Paragraph content";
        }

        @Override
        public boolean enterNode(VisitContext ctx) {
            DocNode node = ctx.node();
            switch (node.kind()) {
                case MATH, MATH_PARAGRAPH -> {
                    addMath(node);
                    return false;
                }
                case RUN -> {
                    addRun(node);
                    return false;
                }
                case TABLE -> {
                    return false;
                }
                default -> {
                    return true;
                }
            }
        }

        private void addRun(DocNode run) {
            List<DocNode> mathGroups = TreeWalker.findOutermost(run, NodeKind.MATH);
            if (!mathGroups.isEmpty()) {
                for (DocNode math : mathGroups) {
                    if (visited.markVisited(math)) {
                        addMath(math);
                    }
                }
                return;
            }

            String text = runText(run);
            if (!text.isEmpty()) {
                String align = verticalAlign(run);
                if ("superscript".equals(align)) {
                    items.add(new ContentItem.Superscript(text));
                } else if ("subscript".equals(align)) {
                    items.add(new ContentItem.Subscript(text));
                } else {
                    items.add(new ContentItem.Text(text));
                }
            }

            for (DocNode drawing : findInRun(run, n -> n.is(NodeKind.DRAWING))) {
                imageRef(drawing).ifPresent(items::add);
            }
            for (DocNode imageData : findInRun(run, n -> n.is(NodeKind.IMAGE_DATA))) {
                vectorImageRef(imageData).ifPresent(items::add);
            }
        }

        private void addMath(DocNode math) {
            String latex = transpiler.toLatex(math);
            if (!latex.isBlank()) {
                items.add(new ContentItem.Math(latex));
            }
        }
    }

    static String runText(DocNode run) {
        boolean underlined = isUnderlined(run);
        StringBuilder sb = new StringBuilder();
        for (DocNode node :
                findInRun(run, n -> n.is(NodeKind.TEXT) || n.is(NodeKind.BREAK))) {
            if (node.is(NodeKind.BREAK)) {
                sb.append('\n');
            } else if (underlined) {
                sb.append(WHITESPACE.matcher(node.textOrEmpty()).replaceAll(UNDERLINE_FILL));
            } else {
                sb.append(node.textOrEmpty());
            }
        }
        return sb.toString();
    }

    /**
     * Descendants of {@code run} matching {@code matcher}, in document order. Only one branch of
     * each {@code mc:AlternateContent} is read: see {@link #selectBranch}.
     */
    static List<DocNode> findInRun(DocNode run, Predicate<DocNode> matcher) {
        List<DocNode> out = new ArrayList<>();
        collectInRun(run, matcher, out);
        return out;
    }

    private static void collectInRun(DocNode node, Predicate<DocNode> matcher, List<DocNode> out) {
        for (DocNode child : node.children()) {
            if (child.is(NodeKind.ALTERNATE_CONTENT)) {
                DocNode branch = selectBranch(child);
                if (branch != null) {
                    collectInRun(branch, matcher, out);
                }
                continue;
            }
            if (matcher.test(child)) {
                out.add(child);
            }
            collectInRun(child, matcher, out);
        }
    }

    /** The first {@code mc:Choice} holding text or a picture, else the {@code mc:Fallback}. */
    static DocNode selectBranch(DocNode alternateContent) {
        for (DocNode choice : TreeWalker.children(alternateContent, NodeKind.CHOICE)) {
            if (!TreeWalker.findAll(choice, RENDERABLE).isEmpty()) {
                return choice;
            }
        }
        return TreeWalker.firstChild(alternateContent, NodeKind.FALLBACK);
    }

    static boolean isUnderlined(DocNode run) {
        DocNode props = TreeWalker.firstChild(run, NodeKind.RUN_PROPERTIES);
        DocNode underline = TreeWalker.firstChild(props, NodeKind.UNDERLINE);
        return underline != null && !"none".equals(underline.val());
    }

    static String verticalAlign(DocNode run) {
        DocNode props = TreeWalker.firstChild(run, NodeKind.RUN_PROPERTIES);
        DocNode align = TreeWalker.firstChild(props, NodeKind.VERTICAL_ALIGN);
        return align != null ? align.val() : null;
    }

    private Optional<ContentItem> imageRef(DocNode drawing) {
        DocNode frame = TreeWalker.findFirst(drawing, NodeKind.INLINE);
        if (frame == null) {
            frame = TreeWalker.findFirst(drawing, NodeKind.ANCHOR);
        }
        if (frame == null) {
            return Optional.empty();
        }
        DocNode blip = TreeWalker.findFirst(frame, NodeKind.BLIP);
        Optional<String> relationshipId = AttributeLookup.BLIP_RELATIONSHIP.find(blip);
        if (relationshipId.isEmpty()) {
            logger.debug("Dropping drawing without relationship id at {}", drawing);
            return Optional.empty();
        }
        String name =
                AttributeLookup.DRAWING_NAME
                        .find(TreeWalker.findFirst(frame, NodeKind.DOC_PROPERTIES))
                        .orElse(defaultImageName);
        return Optional.of(new ContentItem.ImageRef(relationshipId.get(), name));
    }

    private Optional<ContentItem> vectorImageRef(DocNode imageData) {
        Optional<String> relationshipId = AttributeLookup.IMAGE_DATA_RELATIONSHIP.find(imageData);
        if (relationshipId.isEmpty()) {
            logger.debug("Dropping image data without relationship id at {}", imageData);
            return Optional.empty();
        }
        String name = AttributeLookup.IMAGE_DATA_TITLE.find(imageData).orElse(defaultImageName);
        return Optional.of(new ContentItem.VectorImageRef(relationshipId.get(), name));
    }
}

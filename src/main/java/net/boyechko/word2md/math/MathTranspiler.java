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
package net.boyechko.word2md.math;

import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.word2md.document.DocNode;
import net.boyechko.word2md.document.NodeKind;
import net.boyechko.word2md.walk.TreeWalker;

/**
 * Converts an Office Math (OMML) subtree to LaTeX source.
 *
 * <p>Dispatch covers every {@link NodeKind}; kinds without a math meaning pass through by
 * concatenating their children. A structure missing one of its parts renders that part as an
 * empty string. Nothing here throws for a well-formed tree.
 */
public final class MathTranspiler {

    public String toLatex(DocNode node) {
        if (node == null) {
            return "";
        }
        return switch (node.kind()) {
            case MATH_RUN -> mathRun(node);
            case MATH_TEXT, TEXT -> MathSymbols.substitute(node.textOrEmpty());
            case FRACTION -> fraction(node);
            case SUPERSCRIPT -> base(node) + "^{" + group(node, NodeKind.SUP_ARGUMENT, "sup") + "}";
            case SUBSCRIPT -> base(node) + "_{" + group(node, NodeKind.SUB_ARGUMENT, "sub") + "}";
            case SUB_SUPERSCRIPT -> base(node)
                    + "_{"
                    + group(node, NodeKind.SUB_ARGUMENT, "sub")
                    + "}^{"
                    + group(node, NodeKind.SUP_ARGUMENT, "sup")
                    + "}";
            case RADICAL -> radical(node);
            case NARY -> nary(node);
            case ACCENT -> accent(node);
            case DELIMITER -> delimiter(node);
            case FUNCTION -> function(node);
            case LOWER_LIMIT -> limitBase(node) + "_{" + group(node, NodeKind.LIMIT, "lim") + "}";
            case UPPER_LIMIT -> limitBase(node) + "^{" + group(node, NodeKind.LIMIT, "lim") + "}";
            case BAR -> bar(node);
            case EQUATION_ARRAY -> "\\begin{aligned}"
                    + joinArguments(node, " \\\\ ")
                    + "\\end{aligned}";
            case MATRIX -> matrix(node);
            case MATRIX_ROW -> joinArguments(node, " & ");
            case MATH_PROPERTIES, RUN_PROPERTIES, PARAGRAPH_PROPERTIES -> "";
            case MATH,
                    MATH_PARAGRAPH,
                    NUMERATOR,
                    DENOMINATOR,
                    DEGREE,
                    FUNCTION_NAME,
                    LIMIT,
                    ARGUMENT,
                    SUB_ARGUMENT,
                    SUP_ARGUMENT,
                    BODY,
                    PARAGRAPH,
                    PARAGRAPH_STYLE,
                    NUMBERING_PROPERTIES,
                    RUN,
                    UNDERLINE,
                    VERTICAL_ALIGN,
                    BREAK,
                    TABLE,
                    TABLE_ROW,
                    TABLE_CELL,
                    DRAWING,
                    INLINE,
                    ANCHOR,
                    DOC_PROPERTIES,
                    BLIP,
                    IMAGE_DATA,
                    ALTERNATE_CONTENT,
                    CHOICE,
                    FALLBACK,
                    OTHER -> children(node);
        };
    }

    /** Concatenated LaTeX of all children. */
    public String children(DocNode node) {
        if (node == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (DocNode child : node.children()) {
            sb.append(toLatex(child));
        }
        return sb.toString();
    }

    private String mathRun(DocNode run) {
        String text = runText(run);
        String align = verticalAlign(run);
        if ("superscript".equals(align)) {
            return "^{" + MathSymbols.substitute(text) + "}";
        }
        if ("subscript".equals(align)) {
            return "_{" + MathSymbols.substitute(text) + "}";
        }
        if (!text.isEmpty()) {
            return MathSymbols.substitute(text);
        }
        return children(run);
    }

    // m:t text, or w:t text when the run carries none.
    private static String runText(DocNode run) {
        String math = concatText(TreeWalker.findAll(run, NodeKind.MATH_TEXT));
        return !math.isEmpty() ? math : concatText(TreeWalker.findAll(run, NodeKind.TEXT));
    }

    private static String concatText(List<DocNode> nodes) {
        return nodes.stream().map(DocNode::textOrEmpty).collect(Collectors.joining());
    }

    private static String verticalAlign(DocNode run) {
        DocNode props = TreeWalker.firstChild(run, NodeKind.RUN_PROPERTIES);
        DocNode align = TreeWalker.firstChild(props, NodeKind.VERTICAL_ALIGN);
        return align != null ? align.val() : null;
    }

    private String fraction(DocNode node) {
        String num = group(node, NodeKind.NUMERATOR, "num");
        String den = group(node, NodeKind.DENOMINATOR, "den");
        return "\\frac{" + num + "}{" + den + "}";
    }

    private String radical(DocNode node) {
        String degree = group(node, NodeKind.DEGREE, "deg");
        String radicand = group(node, NodeKind.ARGUMENT, "radicand");
        if (!degree.isEmpty()) {
            return "\\sqrt[" + degree + "]{" + radicand + "}";
        }
        return "\\sqrt{" + radicand + "}";
    }

    private String nary(DocNode node) {
        String op = MathSymbols.naryOperator(propertyChar(node, "naryPr", "chr", ""));
        String lower = group(node, NodeKind.SUB_ARGUMENT, "low");
        String upper = group(node, NodeKind.SUP_ARGUMENT, "up");

        StringBuilder sb = new StringBuilder(op);
        if (!lower.isEmpty()) {
            sb.append("_{").append(lower).append('}');
        }
        if (!upper.isEmpty()) {
            sb.append("^{").append(upper).append('}');
        }
        String body = group(node, NodeKind.ARGUMENT, "e");
        if (!body.isBlank()) {
            sb.append(' ').append(body);
        }
        return sb.toString();
    }

    private String accent(DocNode node) {
        String inner = base(node);
        // Word omits m:chr for the default accent, a circumflex.
        String chr = propertyChar(node, "accPr", "chr", "\u0302");
        String lower = chr.toLowerCase();

        if (MathSymbols.BAR_ACCENTS.contains(chr) || lower.contains("bar")) {
            return "\\overline{" + inner + "}";
        }
        if (MathSymbols.HAT_ACCENTS.contains(chr) || lower.contains("hat")) {
            return "\\hat{" + inner + "}";
        }
        if (MathSymbols.TILDE_ACCENTS.contains(chr)) {
            return "\\tilde{" + inner + "}";
        }
        if (MathSymbols.DOT_ACCENTS.contains(chr)) {
            return "\\dot{" + inner + "}";
        }
        if (MathSymbols.DOUBLE_DOT_ACCENTS.contains(chr)) {
            return "\\ddot{" + inner + "}";
        }
        if (MathSymbols.VECTOR_ACCENTS.contains(chr)) {
            return "\\vec{" + inner + "}";
        }
        return "\\overset{" + chr + "}{" + inner + "}";
    }

    private String delimiter(DocNode node) {
        String begin = propertyChar(node, "dPr", "begChr", "(");
        String end = propertyChar(node, "dPr", "endChr", ")");
        String separator = propertyChar(node, "dPr", "sepChr", "|");

        String inner =
                TreeWalker.children(node, NodeKind.ARGUMENT).stream()
                        .map(this::children)
                        .collect(Collectors.joining(separator));
        return "\\left" + fence(begin) + " " + inner + " \\right" + fence(end);
    }

    private static String fence(String chr) {
        return switch (chr) {
            case "" -> ".";
            case "{" -> "\\{";
            case "}" -> "\\}";
            case "⟨", "〈" -> "\\langle";
            case "⟩", "〉" -> "\\rangle";
            case "‖" -> "\\|";
            default -> chr;
        };
    }

    private String function(DocNode node) {
        String name = functionName(group(node, NodeKind.FUNCTION_NAME, "fName"));
        return name + "{" + group(node, NodeKind.ARGUMENT, "e") + "}";
    }

    private String limitBase(DocNode node) {
        return functionName(base(node));
    }

    private static String functionName(String name) {
        String trimmed = name.strip();
        if (MathSymbols.FUNCTION_NAMES.contains(trimmed)) {
            return "\\" + trimmed;
        }
        return name;
    }

    private String bar(DocNode node) {
        String position = propertyChar(node, "barPr", "pos", "bot");
        String command = "top".equals(position) ? "\\overline{" : "\\underline{";
        return command + base(node) + "}";
    }

    private String matrix(DocNode node) {
        String rows =
                TreeWalker.children(node, NodeKind.MATRIX_ROW).stream()
                        .map(row -> joinArguments(row, " & "))
                        .collect(Collectors.joining(" \\\\ "));
        return "\\begin{matrix}" + rows + "\\end{matrix}";
    }

    private String joinArguments(DocNode node, String separator) {
        return TreeWalker.children(node, NodeKind.ARGUMENT).stream()
                .map(this::children)
                .collect(Collectors.joining(separator));
    }

    /** The base expression of a script, accent or bar: {@code m:e}, else {@code m:base}. */
    private String base(DocNode node) {
        return group(node, NodeKind.ARGUMENT, "base");
    }

    /**
     * LaTeX of a child group found by kind, falling back to a child with the given local name in
     * any namespace. A missing group yields the empty string.
     */
    private String group(DocNode parent, NodeKind kind, String fallbackName) {
        DocNode child = TreeWalker.firstChild(parent, kind);
        if (child == null) {
            child = TreeWalker.firstChildNamed(parent, fallbackName);
        }
        return children(child);
    }

    /**
     * Reads a character-valued property such as {@code m:naryPr/m:chr/@m:val}. An absent element
     * yields the default; a present element without {@code m:val} yields its text.
     */
    private static String propertyChar(
            DocNode node, String propertiesName, String elementName, String defaultValue) {
        DocNode props = TreeWalker.firstChildNamed(node, propertiesName);
        DocNode element = TreeWalker.firstChildNamed(props, elementName);
        if (element == null) {
            return defaultValue;
        }
        String value = element.val();
        if (value != null) {
            return value;
        }
        String text = concatText(TreeWalker.findAll(element, NodeKind.MATH_TEXT));
        return !text.isEmpty() ? text : element.textOrEmpty();
    }
}

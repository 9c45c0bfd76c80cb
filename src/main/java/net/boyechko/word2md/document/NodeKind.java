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

import java.util.HashMap;
import java.util.Map;

/**
 * Classification of a document tree element, computed once from its qualified name when the node
 * is built. Names we do not recognize classify as {@link #OTHER}.
 */
public enum NodeKind {
    // WordprocessingML
    BODY,
    PARAGRAPH,
    PARAGRAPH_PROPERTIES,
    PARAGRAPH_STYLE,
    NUMBERING_PROPERTIES,
    RUN,
    RUN_PROPERTIES,
    UNDERLINE,
    VERTICAL_ALIGN,
    TEXT,
    BREAK,
    TABLE,
    TABLE_ROW,
    TABLE_CELL,
    DRAWING,

    // DrawingML and legacy VML
    INLINE,
    ANCHOR,
    DOC_PROPERTIES,
    BLIP,
    IMAGE_DATA,

    // Markup compatibility
    ALTERNATE_CONTENT,
    CHOICE,
    FALLBACK,

    // Office Math
    MATH,
    MATH_PARAGRAPH,
    MATH_RUN,
    MATH_TEXT,
    FRACTION,
    NUMERATOR,
    DENOMINATOR,
    SUPERSCRIPT,
    SUBSCRIPT,
    SUB_SUPERSCRIPT,
    RADICAL,
    DEGREE,
    NARY,
    ACCENT,
    DELIMITER,
    FUNCTION,
    FUNCTION_NAME,
    LOWER_LIMIT,
    UPPER_LIMIT,
    LIMIT,
    BAR,
    EQUATION_ARRAY,
    MATRIX,
    MATRIX_ROW,
    ARGUMENT,
    SUB_ARGUMENT,
    SUP_ARGUMENT,
    MATH_PROPERTIES,

    OTHER;

    private static final Map<String, NodeKind> WORD = new HashMap<>();
    private static final Map<String, NodeKind> DRAWING_NAMES = new HashMap<>();
    private static final Map<String, NodeKind> MATH_NAMES = new HashMap<>();
    private static final Map<String, NodeKind> COMPATIBILITY_NAMES =
            Map.of(
                    "AlternateContent", ALTERNATE_CONTENT,
                    "Choice", CHOICE,
                    "Fallback", FALLBACK);

    static {
        WORD.put("body", BODY);
        WORD.put("p", PARAGRAPH);
        WORD.put("pPr", PARAGRAPH_PROPERTIES);
        WORD.put("pStyle", PARAGRAPH_STYLE);
        WORD.put("numPr", NUMBERING_PROPERTIES);
        WORD.put("r", RUN);
        WORD.put("rPr", RUN_PROPERTIES);
        WORD.put("u", UNDERLINE);
        WORD.put("vertAlign", VERTICAL_ALIGN);
        WORD.put("t", TEXT);
        WORD.put("br", BREAK);
        WORD.put("cr", BREAK);
        WORD.put("tbl", TABLE);
        WORD.put("tr", TABLE_ROW);
        WORD.put("tc", TABLE_CELL);
        WORD.put("drawing", DRAWING);

        DRAWING_NAMES.put("inline", INLINE);
        DRAWING_NAMES.put("anchor", ANCHOR);
        DRAWING_NAMES.put("docPr", DOC_PROPERTIES);

        MATH_NAMES.put("oMath", MATH);
        MATH_NAMES.put("oMathPara", MATH_PARAGRAPH);
        MATH_NAMES.put("r", MATH_RUN);
        MATH_NAMES.put("t", MATH_TEXT);
        MATH_NAMES.put("f", FRACTION);
        MATH_NAMES.put("frac", FRACTION);
        MATH_NAMES.put("num", NUMERATOR);
        MATH_NAMES.put("den", DENOMINATOR);
        MATH_NAMES.put("sSup", SUPERSCRIPT);
        MATH_NAMES.put("sSub", SUBSCRIPT);
        MATH_NAMES.put("sSubSup", SUB_SUPERSCRIPT);
        MATH_NAMES.put("sSupSub", SUB_SUPERSCRIPT);
        MATH_NAMES.put("rad", RADICAL);
        MATH_NAMES.put("deg", DEGREE);
        MATH_NAMES.put("nary", NARY);
        MATH_NAMES.put("acc", ACCENT);
        MATH_NAMES.put("d", DELIMITER);
        MATH_NAMES.put("func", FUNCTION);
        MATH_NAMES.put("fName", FUNCTION_NAME);
        MATH_NAMES.put("limLow", LOWER_LIMIT);
        MATH_NAMES.put("limUpp", UPPER_LIMIT);
        MATH_NAMES.put("lim", LIMIT);
        MATH_NAMES.put("bar", BAR);
        MATH_NAMES.put("eqArr", EQUATION_ARRAY);
        MATH_NAMES.put("m", MATRIX);
        MATH_NAMES.put("mr", MATRIX_ROW);
        MATH_NAMES.put("e", ARGUMENT);
        MATH_NAMES.put("sub", SUB_ARGUMENT);
        MATH_NAMES.put("sup", SUP_ARGUMENT);
    }

    public static NodeKind classify(QName name) {
        String local = name.localName();
        // Legacy image data appears under several VML-ish namespaces.
        if (local.equals("imagedata")) {
            return IMAGE_DATA;
        }
        switch (name.namespace()) {
            case Namespaces.W:
                return WORD.getOrDefault(local, OTHER);
            case Namespaces.WP:
                return DRAWING_NAMES.getOrDefault(local, OTHER);
            case Namespaces.A:
                return local.equals("blip") ? BLIP : OTHER;
            case Namespaces.MC:
                return COMPATIBILITY_NAMES.getOrDefault(local, OTHER);
            case Namespaces.M:
                NodeKind kind = MATH_NAMES.get(local);
                if (kind != null) {
                    return kind;
                }
                return local.endsWith("Pr") ? MATH_PROPERTIES : OTHER;
            default:
                return OTHER;
        }
    }

    public boolean isMathGroup() {
        return this == MATH || this == MATH_PARAGRAPH;
    }
}

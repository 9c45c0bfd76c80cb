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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Fixed Unicode-to-LaTeX tables used by {@link MathTranspiler}. */
public final class MathSymbols {
    private MathSymbols() {}

    private static final Pattern DIVIDE_BEFORE_DIGITS = Pattern.compile("÷(\\d+)");

    private static final Map<String, String> SYMBOLS = new LinkedHashMap<>();
    private static final Map<String, String> NARY_OPERATORS = new LinkedHashMap<>();

    static {
        SYMBOLS.put("×", "\\times");
        SYMBOLS.put("⋅", "\\cdot");
        SYMBOLS.put("÷", "\\div");
        SYMBOLS.put("±", "\\pm");
        SYMBOLS.put("∓", "\\mp");
        SYMBOLS.put("≤", "\\leq");
        SYMBOLS.put("≥", "\\geq");
        SYMBOLS.put("≠", "\\neq");
        SYMBOLS.put("≈", "\\approx");
        SYMBOLS.put("∞", "\\infty");
        SYMBOLS.put("∑", "\\sum");
        SYMBOLS.put("∏", "\\prod");
        SYMBOLS.put("∫", "\\int");
        SYMBOLS.put("√", "\\sqrt");
        SYMBOLS.put("α", "\\alpha");
        SYMBOLS.put("β", "\\beta");
        SYMBOLS.put("γ", "\\gamma");
        SYMBOLS.put("δ", "\\delta");
        SYMBOLS.put("π", "\\pi");
        SYMBOLS.put("θ", "\\theta");
        SYMBOLS.put("λ", "\\lambda");
        SYMBOLS.put("μ", "\\mu");
        SYMBOLS.put("σ", "\\sigma");
        SYMBOLS.put("φ", "\\phi");
        SYMBOLS.put("ω", "\\omega");

        NARY_OPERATORS.put("∑", "\\sum");
        NARY_OPERATORS.put("∫", "\\int");
        NARY_OPERATORS.put("Π", "\\prod");
        NARY_OPERATORS.put("∏", "\\prod");
        NARY_OPERATORS.put("∐", "\\coprod");
        NARY_OPERATORS.put("∮", "\\oint");
        NARY_OPERATORS.put("∬", "\\iint");
        NARY_OPERATORS.put("∭", "\\iiint");
        NARY_OPERATORS.put("⋃", "\\bigcup");
        NARY_OPERATORS.put("⋂", "\\bigcap");
    }

    // Accent characters, spacing and combining forms.
    static final Set<String> BAR_ACCENTS = Set.of("\u00AF", "\u0305", "\u0304", "\u203E");
    static final Set<String> HAT_ACCENTS = Set.of("^", "\u0302", "\u02C6");
    static final Set<String> TILDE_ACCENTS = Set.of("~", "\u0303", "\u02DC");
    static final Set<String> DOT_ACCENTS = Set.of("\u0307", "\u02D9");
    static final Set<String> DOUBLE_DOT_ACCENTS = Set.of("\u0308", "\u00A8");
    static final Set<String> VECTOR_ACCENTS = Set.of("\u20D7", "\u20D6", "\u2192");

    static final Set<String> FUNCTION_NAMES =
            Set.of(
                    "sin", "cos", "tan", "cot", "sec", "csc", "arcsin", "arccos", "arctan", "sinh",
                    "cosh", "tanh", "log", "ln", "lg", "exp", "lim", "max", "min", "sup", "inf",
                    "det", "gcd");

    public static Map<String, String> symbols() {
        return Collections.unmodifiableMap(SYMBOLS);
    }

    /**
     * Replaces every known symbol in leaf text with its LaTeX command, padded with one space on
     * each side. Digits directly after a division sign stay attached to {@code \div}.
     */
    public static String substitute(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String out = DIVIDE_BEFORE_DIGITS.matcher(text).replaceAll(" \\\\div $1");
        for (Map.Entry<String, String> e : SYMBOLS.entrySet()) {
            out = out.replace(e.getKey(), " " + e.getValue() + " ");
        }
        return out;
    }

    /** Maps an n-ary operator character to its command; unknown characters pass through. */
    public static String naryOperator(String chr) {
        String key = chr.strip();
        return NARY_OPERATORS.getOrDefault(key, key);
    }
}

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

import java.util.LinkedHashMap;
import java.util.Map;

/** Namespace URIs of the WordprocessingML parts we read, with their conventional prefixes. */
public final class Namespaces {
    private Namespaces() {}

    public static final String W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String M = "http://schemas.openxmlformats.org/officeDocument/2006/math";
    public static final String WP =
            "http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing";
    public static final String A = "http://schemas.openxmlformats.org/drawingml/2006/main";
    public static final String PIC = "http://schemas.openxmlformats.org/drawingml/2006/picture";
    public static final String R =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    public static final String V = "urn:schemas-microsoft-com:vml";
    public static final String O = "urn:schemas-microsoft-com:office:office";
    public static final String MC =
            "http://schemas.openxmlformats.org/markup-compatibility/2006";

    private static final Map<String, String> PREFIXES = new LinkedHashMap<>();

    static {
        PREFIXES.put(W, "w");
        PREFIXES.put(M, "m");
        PREFIXES.put(WP, "wp");
        PREFIXES.put(A, "a");
        PREFIXES.put(PIC, "pic");
        PREFIXES.put(R, "r");
        PREFIXES.put(V, "v");
        PREFIXES.put(O, "o");
        PREFIXES.put(MC, "mc");
    }

    /** Returns the conventional prefix for a namespace URI, or null if it is not one of ours. */
    public static String prefixFor(String namespace) {
        return PREFIXES.get(namespace);
    }

    /** Prefix-to-URI declarations, e.g. for wrapping XML fragments. */
    public static Map<String, String> declarations() {
        Map<String, String> out = new LinkedHashMap<>();
        PREFIXES.forEach((uri, prefix) -> out.put(prefix, uri));
        return out;
    }

    public static QName w(String localName) {
        return new QName(W, localName);
    }

    public static QName m(String localName) {
        return new QName(M, localName);
    }

    public static QName r(String localName) {
        return new QName(R, localName);
    }

    public static QName o(String localName) {
        return new QName(O, localName);
    }
}

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

import javax.xml.XMLConstants;

/**
 * A namespace-qualified element or attribute name. Unqualified names use the empty string as
 * namespace.
 */
public record QName(String namespace, String localName) {

    public QName {
        namespace = namespace == null ? "" : namespace;
        if (localName == null || localName.isEmpty()) {
            throw new IllegalArgumentException("Local name is required");
        }
    }

    public static QName unqualified(String localName) {
        return new QName("", localName);
    }

    public boolean isQualified() {
        return !namespace.isEmpty();
    }

    public boolean hasLocalName(String name) {
        return localName.equals(name);
    }

    /** Returns {@code prefix:local} for known namespaces, Clark notation otherwise. */
    public String toPrefixedString() {
        if (!isQualified()) {
            return localName;
        }
        if (XMLConstants.XML_NS_URI.equals(namespace)) {
            return XMLConstants.XML_NS_PREFIX + ":" + localName;
        }
        String prefix = Namespaces.prefixFor(namespace);
        return prefix != null ? prefix + ":" + localName : toString();
    }

    @Override
    public String toString() {
        return isQualified() ? "{" + namespace + "}" + localName : localName;
    }
}

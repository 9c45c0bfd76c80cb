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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import net.boyechko.word2md.document.DocNode;
import net.boyechko.word2md.document.Namespaces;
import net.boyechko.word2md.document.QName;

/**
 * An ordered list of attribute candidates. The first candidate present on a node with a non-blank
 * value wins. Word writers disagree on where relationship ids and titles go, so each lookup is
 * spelled out here as data.
 */
public final class AttributeLookup {

    /** Matches one or more attribute names. */
    public record Candidate(String description, Predicate<QName> matcher) {

        public static Candidate exact(QName name) {
            return new Candidate(name.toPrefixedString(), name::equals);
        }

        /** Any namespace-qualified attribute with the given local name. */
        public static Candidate anyQualified(String localName) {
            return new Candidate(
                    "*:" + localName, q -> q.isQualified() && q.hasLocalName(localName));
        }
    }

    public static final AttributeLookup BLIP_RELATIONSHIP =
            new AttributeLookup(Candidate.exact(Namespaces.r("embed")));

    public static final AttributeLookup IMAGE_DATA_RELATIONSHIP =
            new AttributeLookup(
                    Candidate.exact(Namespaces.r("id")),
                    Candidate.exact(Namespaces.o("relid")),
                    Candidate.anyQualified("id"));

    public static final AttributeLookup IMAGE_DATA_TITLE =
            new AttributeLookup(
                    Candidate.exact(Namespaces.o("title")),
                    Candidate.exact(QName.unqualified("title")),
                    Candidate.exact(QName.unqualified("alt")));

    public static final AttributeLookup DRAWING_NAME =
            new AttributeLookup(Candidate.exact(QName.unqualified("name")));

    private final List<Candidate> candidates;

    public AttributeLookup(Candidate... candidates) {
        this.candidates = List.of(candidates);
    }

    public List<Candidate> candidates() {
        return candidates;
    }

    /** Returns the value of the highest-priority candidate present on {@code node}. */
    public Optional<String> find(DocNode node) {
        if (node == null) {
            return Optional.empty();
        }
        for (Candidate candidate : candidates) {
            for (Map.Entry<QName, String> attr : node.attributes().entrySet()) {
                String value = attr.getValue();
                if (candidate.matcher().test(attr.getKey()) && value != null && !value.isBlank()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }
}

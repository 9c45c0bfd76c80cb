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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.word2md.content.ContentItem.ImageRef;
import net.boyechko.word2md.content.ContentItem.Math;
import net.boyechko.word2md.content.ContentItem.Subscript;
import net.boyechko.word2md.content.ContentItem.Superscript;
import net.boyechko.word2md.content.ContentItem.Text;
import org.junit.jupiter.api.Test;

class ScriptMergerTest {

    @Test
    void textWithBothScriptsBecomesMath() {
        assertEquals(
                List.of(new Math("x_{i}^{2}")),
                ScriptMerger.merge(List.of(new Text("x"), new Subscript("i"), new Superscript("2"))));
    }

    @Test
    void subscriptAlwaysPrecedesSuperscript() {
        assertEquals(
                List.of(new Math("x_{i}^{2}")),
                ScriptMerger.merge(List.of(new Text("x"), new Superscript("2"), new Subscript("i"))));
    }

    @Test
    void consecutiveScriptsOfOneKindAreJoined() {
        assertEquals(
                List.of(new Math("e^{-x}")),
                ScriptMerger.merge(List.of(new Text("e"), new Superscript("-"), new Superscript("x"))));
    }

    @Test
    void loneScriptsBecomeMath() {
        assertEquals(
                List.of(new Math("^{2}"), new Math("_{n}")),
                ScriptMerger.merge(List.of(new Superscript("2"), new Subscript("n"))));
    }

    @Test
    void scriptAfterMathIsNotAttached() {
        assertEquals(
                List.of(new Math("m"), new Math("^{2}")),
                ScriptMerger.merge(List.of(new Math("m"), new Superscript("2"))));
    }

    @Test
    void otherItemsPassThroughInOrder() {
        ImageRef image = new ImageRef("rId1", "P");

        assertEquals(
                List.of(new Text("a"), image, new Math("b^{2}"), new Math("m"), new Text("c")),
                ScriptMerger.merge(
                        List.of(
                                new Text("a"),
                                image,
                                new Text("b"),
                                new Superscript("2"),
                                new Math("m"),
                                new Text("c"))));
    }

    @Test
    void textFollowedByEmptyScriptsIsUnchanged() {
        assertEquals(
                List.of(new Text("a")),
                ScriptMerger.merge(List.of(new Text("a"), new Superscript(""))));
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertTrue(ScriptMerger.merge(List.of()).isEmpty());
    }
}

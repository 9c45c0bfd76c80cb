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

/**
 * Folds superscript and subscript runs into the text run before them. Word stores {@code x²} as
 * a plain run "x" followed by a run flagged as superscript; this pass turns that pair back into
 * {@code x^{2}}.
 */
public final class ScriptMerger {
    private ScriptMerger() {}

    public static List<ContentItem> merge(List<ContentItem> items) {
        List<ContentItem> merged = new ArrayList<>(items.size());
        int i = 0;
        while (i < items.size()) {
            ContentItem item = items.get(i);
            if (item instanceof ContentItem.Text text) {
                StringBuilder sub = new StringBuilder();
                StringBuilder sup = new StringBuilder();
                int j = i + 1;
                while (j < items.size()) {
                    ContentItem next = items.get(j);
                    if (next instanceof ContentItem.Superscript s) {
                        sup.append(s.value());
                    } else if (next instanceof ContentItem.Subscript s) {
                        sub.append(s.value());
                    } else {
                        break;
                    }
                    j++;
                }
                if (sub.length() == 0 && sup.length() == 0) {
                    merged.add(text);
                } else {
                    merged.add(new ContentItem.Math(scripted(text.value(), sub, sup)));
                }
                i = j;
                continue;
            }

            if (item instanceof ContentItem.Superscript s) {
                merged.add(new ContentItem.Math("^{" + s.value() + "}"));
            } else if (item instanceof ContentItem.Subscript s) {
                merged.add(new ContentItem.Math("_{" + s.value() + "}"));
            } else {
                merged.add(item);
            }
            i++;
        }
        return merged;
    }

    private static String scripted(String base, CharSequence sub, CharSequence sup) {
        StringBuilder sb = new StringBuilder(base);
        if (sub.length() > 0) {
            sb.append("_{").append(sub).append('}');
        }
        if (sup.length() > 0) {
            sb.append("^{").append(sup).append('}');
        }
        return sb.toString();
    }
}

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
package net.boyechko.word2md.media;

import net.boyechko.word2md.content.ContentItem;

/** Renders image content items as Markdown image references, numbering them as it goes. */
public final class ImageLinks {
    private final String documentName;
    private final MediaLayout layout;
    private final ImageExtensionResolver resolver;
    private final ImageCounters counters;

    public ImageLinks(
            String documentName,
            MediaLayout layout,
            ImageExtensionResolver resolver,
            ImageCounters counters) {
        this.documentName = documentName;
        this.layout = layout;
        this.resolver = resolver;
        this.counters = counters;
    }

    public ImageCounters counters() {
        return counters;
    }

    public String render(ContentItem.ImageRef image) {
        return link(MediaKind.RASTER, image.relationshipId(), image.displayName());
    }

    public String render(ContentItem.VectorImageRef image) {
        return link(MediaKind.VECTOR, image.relationshipId(), image.displayName());
    }

    private String link(MediaKind kind, String relationshipId, String displayName) {
        String ext = resolver.extensionFor(kind, relationshipId);
        int number = counters.next(kind);
        return "!["
                + displayName
                + "]("
                + layout.mediaRoot()
                + "/"
                + MediaLayout.imagesDirName(documentName)
                + "/"
                + layout.dirFor(kind)
                + "/image"
                + number
                + "."
                + ext
                + ")";
    }
}

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

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.word2md.content.ContentItem;
import org.junit.jupiter.api.Test;

class ImageLinksTest {

    @Test
    void rasterAndVectorLinksAreNumberedIndependently() {
        ImageLinks links =
                new ImageLinks(
                        "report",
                        MediaLayout.DEFAULT,
                        ImageExtensionResolver.fixed("png", "wmf"),
                        new ImageCounters());

        assertEquals(
                "![Picture 1](../Images/report_images/PNG/image1.png)",
                links.render(new ContentItem.ImageRef("rId1", "Picture 1")));
        assertEquals(
                "![Eq](../Images/report_images/WMF/image1.wmf)",
                links.render(new ContentItem.VectorImageRef("rId2", "Eq")));
        assertEquals(
                "![Picture 2](../Images/report_images/PNG/image2.png)",
                links.render(new ContentItem.ImageRef("rId3", "Picture 2")));
        assertEquals(3, links.counters().peekRaster());
        assertEquals(2, links.counters().peekVector());
    }

    @Test
    void layoutAndResolverShapeTheLink() {
        MediaLayout layout = new MediaLayout("media", "raster", "vector", "bin");
        ImageExtensionResolver resolver =
                (kind, id) -> "rId9".equals(id) ? "emf" : kind == MediaKind.RASTER ? "jpg" : "wmf";
        ImageLinks links = new ImageLinks("d", layout, resolver, new ImageCounters());

        assertEquals(
                "![x](media/d_images/vector/image1.emf)",
                links.render(new ContentItem.VectorImageRef("rId9", "x")));
        assertEquals(
                "![y](media/d_images/raster/image1.jpg)",
                links.render(new ContentItem.ImageRef("rId1", "y")));
    }

    @Test
    void countersCanBeReset() {
        ImageCounters counters = new ImageCounters();
        counters.next(MediaKind.RASTER);
        counters.next(MediaKind.VECTOR);

        counters.reset();

        assertEquals(1, counters.peekRaster());
        assertEquals(1, counters.peekVector());
        assertThrows(IllegalArgumentException.class, () -> counters.next(MediaKind.BINARY));
    }

    @Test
    void mediaKindsByExtension() {
        assertEquals(MediaKind.RASTER, MediaKind.forFileName("/word/media/a.TIFF").orElseThrow());
        assertEquals(MediaKind.VECTOR, MediaKind.forFileName("b.emf").orElseThrow());
        assertEquals(MediaKind.BINARY, MediaKind.forFileName("oleObject1.bin").orElseThrow());
        assertTrue(MediaKind.forFileName("/word/media.dir/noext").isEmpty());
        assertEquals("", MediaKind.extensionOf(".hidden"));
    }
}

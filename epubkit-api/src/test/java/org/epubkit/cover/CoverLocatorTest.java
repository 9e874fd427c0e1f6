package org.epubkit.cover;

import org.epubkit.model.ManifestItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CoverLocatorTest {

    private final CoverLocator locator = new CoverLocator();

    private static ManifestItem item(String id, String href, String mediaType) {
        return ManifestItem.builder().id(id).href(href).mediaType(mediaType).build();
    }

    @Test
    void locate_coverIdWithImageMediaType() {
        ManifestItem cover = item("cover", "images/cover.jpg", "image/jpeg");

        assertThat(locator.locate(List.of(item("c1", "c1.xhtml", "application/xhtml+xml"), cover))).contains(cover);
    }

    @Test
    void locate_skipsHtmlCoverPageAndTriesNextId() {
        ManifestItem coverPage = item("cover", "cover.xhtml", "application/xhtml+xml");
        ManifestItem coverImage = item("cover-image", "images/front.png", "image/png");

        assertThat(locator.locate(List.of(coverPage, coverImage))).contains(coverImage);
    }

    @Test
    void locate_candidateIdsTriedInFixedOrder() {
        ManifestItem coverImg = item("cover-img", "a.gif", "image/gif");
        ManifestItem coverImage = item("cover-image", "b.gif", "image/gif");

        assertThat(locator.locate(List.of(coverImg, coverImage))).contains(coverImage);
    }

    @Test
    void locate_extensionSniffingIsCaseInsensitive() {
        ManifestItem cover = item("cover-img", "IMAGES/COVER.JPEG", "application/octet-stream");

        assertThat(locator.locate(List.of(cover))).contains(cover);
    }

    @Test
    void locate_noConventionalId_yieldsEmpty() {
        List<ManifestItem> manifest = List.of(
                item("front", "front.jpg", "image/jpeg"),
                item("cover", "cover.svg", "application/xml"));

        assertThat(locator.locate(manifest)).isEmpty();
    }

    @Test
    void isImage_checksMediaTypeThenExtension() {
        assertThat(CoverLocator.isImage(item("x", "x.bin", "image/webp"))).isTrue();
        assertThat(CoverLocator.isImage(item("x", "x.png", ""))).isTrue();
        assertThat(CoverLocator.isImage(item("x", "x.webp", ""))).isFalse();
    }
}

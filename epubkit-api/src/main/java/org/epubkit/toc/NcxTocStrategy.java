package org.epubkit.toc;

import lombok.extern.slf4j.Slf4j;
import org.epubkit.archive.EpubArchive;
import org.epubkit.model.ManifestItem;
import org.epubkit.model.NavPoint;
import org.epubkit.model.TableOfContents;
import org.epubkit.util.EpubPaths;
import org.epubkit.util.XmlUtils;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * EPUB 2 navigation control file ({@code toc.ncx}).
 */
@Slf4j
public class NcxTocStrategy implements TocStrategy {

    public static final String NCX_MEDIA_TYPE = "application/x-dtbncx+xml";

    @Override
    public Optional<ManifestItem> locate(List<ManifestItem> manifest) {
        return manifest.stream()
                .filter(item -> NCX_MEDIA_TYPE.equals(item.getMediaType()))
                .findFirst();
    }

    @Override
    public Optional<TableOfContents> read(EpubArchive archive, String rootFile, ManifestItem item) {
        String ncxPath = EpubPaths.resolve(EpubPaths.parentDirectory(rootFile), item.getHref());
        byte[] data = archive.readBytes(ncxPath);
        Element ncx = XmlUtils.parse(data, ncxPath).getDocumentElement();

        String title = XmlUtils.firstChild(ncx, "docTitle")
                .map(docTitle -> XmlUtils.childText(docTitle, "text"))
                .orElse("");
        List<NavPoint> navPoints = XmlUtils.firstChild(ncx, "navMap")
                .map(this::parseNavPoints)
                .orElse(List.of());

        log.debug("Parsed NCX {}: {} top-level nav points", ncxPath, navPoints.size());
        return Optional.of(TableOfContents.builder()
                .title(title)
                .navPoints(navPoints)
                .build());
    }

    private List<NavPoint> parseNavPoints(Element parent) {
        List<NavPoint> navPoints = new ArrayList<>();
        for (Element navPoint : XmlUtils.childElements(parent, "navPoint")) {
            navPoints.add(parseNavPoint(navPoint));
        }
        return List.copyOf(navPoints);
    }

    private NavPoint parseNavPoint(Element navPoint) {
        String label = XmlUtils.firstChild(navPoint, "navLabel")
                .map(navLabel -> XmlUtils.childText(navLabel, "text"))
                .orElse("");
        String src = XmlUtils.firstChild(navPoint, "content")
                .map(content -> XmlUtils.attribute(content, "src"))
                .orElse("");

        return NavPoint.builder()
                .id(XmlUtils.attribute(navPoint, "id"))
                .playOrder(XmlUtils.attribute(navPoint, "playOrder"))
                .label(label)
                .src(src)
                .children(parseNavPoints(navPoint))
                .build();
    }
}

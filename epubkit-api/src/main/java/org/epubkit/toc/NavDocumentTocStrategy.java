package org.epubkit.toc;

import lombok.extern.slf4j.Slf4j;
import org.epubkit.archive.EpubArchive;
import org.epubkit.model.ManifestItem;
import org.epubkit.model.TableOfContents;

import java.util.List;
import java.util.Optional;

/**
 * EPUB 3 navigation document. The document is detected but its {@code <nav>} markup is not
 * parsed, so reading always yields no table of contents.
 */
@Slf4j
public class NavDocumentTocStrategy implements TocStrategy {

    private static final String NAV_PROPERTY = "nav";

    @Override
    public Optional<ManifestItem> locate(List<ManifestItem> manifest) {
        return manifest.stream()
                .filter(item -> item.hasProperty(NAV_PROPERTY))
                .findFirst()
                .or(() -> manifest.stream().filter(ManifestItem::isHtml).findFirst());
    }

    @Override
    public Optional<TableOfContents> read(EpubArchive archive, String rootFile, ManifestItem item) {
        // TODO: parse <nav epub:type="toc"> lists into NavPoint trees
        log.debug("EPUB 3 navigation document candidate '{}' is not parsed, no table of contents", item.getHref());
        return Optional.empty();
    }
}

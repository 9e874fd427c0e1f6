package org.epubkit.toc;

import org.epubkit.archive.EpubArchive;
import org.epubkit.model.ManifestItem;
import org.epubkit.model.TableOfContents;

import java.util.List;
import java.util.Optional;

/**
 * One table-of-contents format. {@link TocResolver} asks each strategy in turn to locate its
 * document; the first strategy that locates one decides the outcome.
 */
public interface TocStrategy {

    Optional<ManifestItem> locate(List<ManifestItem> manifest);

    Optional<TableOfContents> read(EpubArchive archive, String rootFile, ManifestItem item);
}

package org.epubkit.toc;

import org.epubkit.archive.EpubArchive;
import org.epubkit.model.ManifestItem;
import org.epubkit.model.TableOfContents;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the table of contents by trying the NCX strategy first and the navigation document
 * strategy second. Finding neither is not an error.
 */
public class TocResolver {

    private final List<TocStrategy> strategies;

    public TocResolver() {
        this(List.of(new NcxTocStrategy(), new NavDocumentTocStrategy()));
    }

    public TocResolver(List<TocStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public Optional<TableOfContents> resolve(EpubArchive archive, String rootFile, List<ManifestItem> manifest) {
        for (TocStrategy strategy : strategies) {
            Optional<ManifestItem> located = strategy.locate(manifest);
            if (located.isPresent()) {
                return strategy.read(archive, rootFile, located.get());
            }
        }
        return Optional.empty();
    }
}

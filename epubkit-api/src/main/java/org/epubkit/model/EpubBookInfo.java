package org.epubkit.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of a book's package, detached from the archive it was read from.
 */
@Value
@Builder
public class EpubBookInfo {
    String rootFile;
    String rootPath;
    Metadata metadata;
    @Builder.Default
    List<ManifestItem> manifest = List.of();
    @Builder.Default
    List<SpineItemRef> spine = List.of();
    TableOfContents toc;
    String coverPath;
}

package org.epubkit.chapter;

import lombok.extern.slf4j.Slf4j;
import org.epubkit.Epub;
import org.epubkit.exception.EpubError;
import org.epubkit.exception.EpubException;
import org.epubkit.model.Chapter;
import org.epubkit.model.ManifestItem;
import org.epubkit.model.NavPoint;
import org.epubkit.model.SpineItemRef;
import org.epubkit.model.TableOfContents;
import org.epubkit.options.CancellationToken;
import org.epubkit.options.EpubOptions;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the spine into chapters.
 * <p>
 * Only HTML-bearing spine items become chapters. A chapter's order is its 1-based spine
 * position, and its title comes from the top-level NCX nav point at the same position when
 * there is one. That pairing is positional, not by href, and mislabels chapters when the table
 * of contents is nested or ordered differently from the spine.
 */
@Slf4j
public class ChapterExtractor {

    static final int CANCELLATION_CHECK_INTERVAL = 5;

    /**
     * Bulk walk over the spine. Unresolvable, non-HTML, unreadable, oversized and filtered
     * entries are skipped; only cancellation aborts the call, discarding what was collected.
     */
    public List<Chapter> getChapters(Epub epub, EpubOptions options) {
        CancellationToken cancellation = options.getCancellation();
        cancellation.throwIfCancelled();

        List<SpineItemRef> spine = epub.getSpine();
        List<Chapter> chapters = new ArrayList<>();

        for (int i = 0; i < spine.size(); i++) {
            if (i % CANCELLATION_CHECK_INTERVAL == 0) {
                cancellation.throwIfCancelled();
            }

            String idref = spine.get(i).getIdref();
            Optional<ManifestItem> found = epub.findItemById(idref);
            if (found.isEmpty()) {
                log.debug("Skipping spine entry {}: no manifest item '{}'", i, idref);
                continue;
            }
            ManifestItem item = found.get();
            if (!item.isHtml()) {
                log.debug("Skipping spine entry {}: media type '{}' is not HTML", i, item.getMediaType());
                continue;
            }

            byte[] content;
            try {
                content = epub.readFile(epub.resolveHref(item.getHref()));
            } catch (EpubException e) {
                log.debug("Skipping spine entry {}: {}", i, e.getMessage());
                continue;
            }

            if (options.exceedsMaxContentLength(content.length)) {
                log.debug("Skipping spine entry {}: {} bytes exceeds limit of {}",
                        i, content.length, options.getMaxContentLength());
                continue;
            }

            Chapter chapter = Chapter.builder()
                    .title(titleFor(epub.getTableOfContents(), i))
                    .content(new String(content, StandardCharsets.UTF_8))
                    .order(i + 1)
                    .build();

            if (!options.accepts(chapter)) {
                continue;
            }
            chapters.add(chapter);
        }

        return List.copyOf(chapters);
    }

    /**
     * Single-chapter access by 0-based spine index. Unlike {@link #getChapters}, every problem
     * is reported, including exceeding the configured maximum length.
     */
    public String getChapterContent(Epub epub, int index, EpubOptions options) {
        options.getCancellation().throwIfCancelled();

        List<SpineItemRef> spine = epub.getSpine();
        if (index < 0 || index >= spine.size()) {
            throw EpubError.OUT_OF_RANGE.createException(index, spine.size());
        }

        String idref = spine.get(index).getIdref();
        ManifestItem item = epub.findItemById(idref)
                .orElseThrow(() -> EpubError.NOT_FOUND.createException(
                        "Manifest item '" + idref + "' for chapter " + index));
        if (!item.isHtml()) {
            throw EpubError.UNSUPPORTED_CONTENT.createException(index, item.getMediaType());
        }

        byte[] content = epub.readFile(epub.resolveHref(item.getHref()));
        if (options.exceedsMaxContentLength(content.length)) {
            throw EpubError.CONTENT_TOO_LARGE.createException(index, content.length, options.getMaxContentLength());
        }
        return new String(content, StandardCharsets.UTF_8);
    }

    static String titleFor(Optional<TableOfContents> toc, int spineIndex) {
        return toc.map(TableOfContents::getNavPoints)
                .filter(navPoints -> spineIndex < navPoints.size())
                .map(navPoints -> navPoints.get(spineIndex))
                .map(NavPoint::getLabel)
                .orElse("Chapter " + (spineIndex + 1));
    }
}

package org.epubkit.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.epubkit.Epub;
import org.epubkit.config.EpubReaderProperties;
import org.epubkit.exception.EpubError;
import org.epubkit.model.Chapter;
import org.epubkit.model.EpubBookInfo;
import org.epubkit.options.EpubOption;
import org.epubkit.options.EpubOptions;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Path-based access to EPUB files for application code. Each call opens the book, runs the
 * query and closes it again, so no parsed state outlives a call.
 */
@Slf4j
@RequiredArgsConstructor
public class EpubLibraryService {

    private final EpubReaderProperties properties;

    public EpubBookInfo getBookInfo(Path epubPath) {
        log.debug("Describing EPUB: {}", epubPath.getFileName());
        return withEpub(epubPath, this::describe);
    }

    public List<Chapter> getChapters(Path epubPath, EpubOption... options) {
        EpubOptions effective = defaultOptions().with(List.of(options));
        return withEpub(epubPath, epub -> epub.getChapters(effective));
    }

    public String getChapterContent(Path epubPath, int index, EpubOption... options) {
        EpubOptions effective = defaultOptions().with(List.of(options));
        return withEpub(epubPath, epub -> epub.getChapterContent(index, effective));
    }

    /**
     * Copies an archive entry, addressed from the archive root, to {@code outputStream}.
     */
    public void streamFile(Path epubPath, String filePath, OutputStream outputStream) {
        String cleanPath = filePath.startsWith("/") ? filePath.substring(1) : filePath;
        withEpub(epubPath, epub -> {
            try (InputStream in = epub.getFileStream(cleanPath)) {
                return IOUtils.copyLarge(in, outputStream);
            } catch (IOException e) {
                throw EpubError.ACCESS_ERROR.createException(e, cleanPath, e.getMessage());
            }
        });
    }

    /**
     * Copies the cover image to {@code outputStream}.
     *
     * @return false when the book has no recognizable cover
     */
    public boolean streamCover(Path epubPath, OutputStream outputStream) {
        return withEpub(epubPath, epub -> {
            Optional<InputStream> cover = epub.getCover();
            if (cover.isEmpty()) {
                return false;
            }
            try (InputStream in = cover.get()) {
                IOUtils.copyLarge(in, outputStream);
                return true;
            } catch (IOException e) {
                throw EpubError.ACCESS_ERROR.createException(e, "cover of " + epubPath.getFileName(), e.getMessage());
            }
        });
    }

    EpubOptions defaultOptions() {
        return EpubOptions.of(EpubOptions.withMaxContentLength(properties.getMaxContentLength()));
    }

    private EpubBookInfo describe(Epub epub) {
        return EpubBookInfo.builder()
                .rootFile(epub.getRootFile())
                .rootPath(epub.resolveHref(""))
                .metadata(epub.getMetadata())
                .manifest(epub.getItems())
                .spine(epub.getSpine())
                .toc(epub.getTableOfContents().orElse(null))
                .coverPath(epub.getCoverItem().map(item -> epub.resolveHref(item.getHref())).orElse(null))
                .build();
    }

    private <T> T withEpub(Path epubPath, Function<Epub, T> query) {
        Charset charset = Charset.forName(properties.getEntryEncoding());
        try (Epub epub = Epub.open(epubPath, charset)) {
            return query.apply(epub);
        } catch (IOException e) {
            log.warn("Failed to close EPUB {}: {}", epubPath.getFileName(), e.getMessage());
            throw EpubError.ACCESS_ERROR.createException(e, epubPath, e.getMessage());
        }
    }
}

package org.epubkit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.epubkit.archive.EpubArchive;
import org.epubkit.chapter.ChapterExtractor;
import org.epubkit.cover.CoverLocator;
import org.epubkit.model.Chapter;
import org.epubkit.model.ManifestItem;
import org.epubkit.model.Metadata;
import org.epubkit.model.PackageDocument;
import org.epubkit.model.SpineItemRef;
import org.epubkit.model.TableOfContents;
import org.epubkit.options.EpubOption;
import org.epubkit.options.EpubOptions;
import org.epubkit.parser.ContainerResolver;
import org.epubkit.parser.PackageDocumentParser;
import org.epubkit.toc.TocResolver;
import org.epubkit.util.EpubPaths;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * A parsed EPUB: metadata, manifest, spine and the optional NCX table of contents, plus
 * queries that read chapter and resource bytes from the archive on demand.
 * <p>
 * Instances come only from {@link #open(Path)} or {@link #from(ZipFile)}, which run the whole
 * pipeline (container, package document, table of contents) and never return a partially
 * parsed book. After {@link #close()} the parsed model stays readable but every query that
 * touches the archive throws {@link IllegalStateException}.
 * <p>
 * Not thread-safe; share an instance across threads only with external synchronization.
 */
@Slf4j
public class Epub implements Closeable {

    private static final ContainerResolver CONTAINER_RESOLVER = new ContainerResolver();
    private static final PackageDocumentParser PACKAGE_PARSER = new PackageDocumentParser();
    private static final TocResolver TOC_RESOLVER = new TocResolver();
    private static final ChapterExtractor CHAPTER_EXTRACTOR = new ChapterExtractor();
    private static final CoverLocator COVER_LOCATOR = new CoverLocator();

    private final EpubArchive archive;
    /** Archive path of the package document, e.g. {@code OEBPS/content.opf}. */
    @Getter
    private final String rootFile;
    private final PackageDocument packageDocument;
    private final TableOfContents tableOfContents;

    private Epub(EpubArchive archive, String rootFile, PackageDocument packageDocument, TableOfContents tableOfContents) {
        this.archive = archive;
        this.rootFile = rootFile;
        this.packageDocument = packageDocument;
        this.tableOfContents = tableOfContents;
    }

    /**
     * Opens the file and takes ownership of it; {@link #close()} releases it.
     */
    public static Epub open(Path path) {
        return open(path, StandardCharsets.UTF_8);
    }

    /**
     * Same as {@link #open(Path)} for archives whose entry names are not UTF-8 encoded.
     */
    public static Epub open(Path path, Charset entryNameCharset) {
        log.debug("Opening EPUB {}", path);
        return load(EpubArchive.open(path, entryNameCharset));
    }

    /**
     * Parses an archive owned by the caller, who stays responsible for closing it.
     */
    public static Epub from(ZipFile zipFile) {
        return load(EpubArchive.borrow(zipFile));
    }

    static Epub load(EpubArchive archive) {
        try {
            String rootFile = CONTAINER_RESOLVER.resolve(archive);
            PackageDocument packageDocument = PACKAGE_PARSER.parse(archive, rootFile);
            TableOfContents toc = TOC_RESOLVER.resolve(archive, rootFile, packageDocument.getManifest()).orElse(null);
            return new Epub(archive, rootFile, packageDocument, toc);
        } catch (RuntimeException e) {
            try {
                archive.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    public String getTitle() {
        return getMetadata().getTitle();
    }

    public String getAuthor() {
        return getMetadata().getCreator();
    }

    public String getDescription() {
        return getMetadata().getDescription();
    }

    public Metadata getMetadata() {
        return packageDocument.getMetadata();
    }

    /** Manifest items in document order. */
    public List<ManifestItem> getItems() {
        return packageDocument.getManifest();
    }

    public List<SpineItemRef> getSpine() {
        return packageDocument.getSpine();
    }

    public Optional<TableOfContents> getTableOfContents() {
        return Optional.ofNullable(tableOfContents);
    }

    /** First manifest item with this id; duplicates after it are never returned. */
    public Optional<ManifestItem> findItemById(String id) {
        return getItems().stream()
                .filter(item -> item.getId().equals(id))
                .findFirst();
    }

    public Optional<ManifestItem> findItemByHref(String href) {
        String wanted = EpubPaths.normalizeSeparators(href);
        return getItems().stream()
                .filter(item -> EpubPaths.normalizeSeparators(item.getHref()).equals(wanted))
                .findFirst();
    }

    /**
     * Archive path of a manifest href, which is relative to the package document's directory.
     */
    public String resolveHref(String href) {
        return EpubPaths.resolve(EpubPaths.parentDirectory(rootFile), href);
    }

    public List<String> getEntryNames() {
        return archive.entryNames();
    }

    /** Raw bytes of an archive entry addressed from the archive root. */
    public byte[] readFile(String path) {
        return archive.readBytes(path);
    }

    /**
     * Stream over an archive entry addressed from the archive root. The caller must close it.
     */
    public InputStream getFileStream(String path) {
        return archive.openStream(path);
    }

    public List<Chapter> getChapters(EpubOption... options) {
        return getChapters(EpubOptions.of(options));
    }

    public List<Chapter> getChapters(EpubOptions options) {
        return CHAPTER_EXTRACTOR.getChapters(this, options);
    }

    /**
     * Content of the spine entry at a 0-based index. Fails when the entry is oversized instead of
     * skipping it as {@link #getChapters} does.
     */
    public String getChapterContent(int index, EpubOption... options) {
        return getChapterContent(index, EpubOptions.of(options));
    }

    public String getChapterContent(int index, EpubOptions options) {
        return CHAPTER_EXTRACTOR.getChapterContent(this, index, options);
    }

    public InputStream getChapterStream(int index, EpubOption... options) {
        String content = getChapterContent(index, options);
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    public Optional<ManifestItem> getCoverItem() {
        return COVER_LOCATOR.locate(getItems());
    }

    /**
     * Stream over the cover image, or empty when no manifest item looks like one. The caller
     * must close a returned stream.
     */
    public Optional<InputStream> getCover() {
        return getCoverItem().map(item -> getFileStream(resolveHref(item.getHref())));
    }

    public boolean isClosed() {
        return archive.isClosed();
    }

    /**
     * Releases the archive if this instance opened it. Calling it again does nothing.
     */
    @Override
    public void close() throws IOException {
        archive.close();
    }
}

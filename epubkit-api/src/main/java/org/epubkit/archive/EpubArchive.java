package org.epubkit.archive;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.IOUtils;
import org.epubkit.exception.EpubError;
import org.epubkit.util.EpubPaths;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Optional;

/**
 * Name-based access to the entries of an EPUB zip container.
 * <p>
 * Lookups compare names case-sensitively after normalizing separators to '/', scanning the
 * central directory in order. EPUBs hold tens to low hundreds of entries, so no index is kept.
 */
@Slf4j
public class EpubArchive implements Closeable {

    private final ZipFile zipFile;
    private final boolean owned;
    private final String name;
    private volatile boolean closed;

    private EpubArchive(ZipFile zipFile, boolean owned, String name) {
        this.zipFile = zipFile;
        this.owned = owned;
        this.name = name;
    }

    public static EpubArchive open(Path path, Charset charset) {
        try {
            ZipFile zipFile = ZipFile.builder()
                    .setPath(path)
                    .setCharset(charset)
                    .setUseUnicodeExtraFields(true)
                    .get();
            return new EpubArchive(zipFile, true, path.getFileName().toString());
        } catch (IOException e) {
            throw EpubError.ACCESS_ERROR.createException(e, path, e.getMessage());
        }
    }

    /**
     * Wraps a zip file owned by the caller. Closing the returned archive leaves it open.
     */
    public static EpubArchive borrow(ZipFile zipFile) {
        return new EpubArchive(zipFile, false, "borrowed archive");
    }

    public List<String> entryNames() {
        ensureOpen();
        List<String> names = new ArrayList<>();
        Enumeration<ZipArchiveEntry> entries = zipFile.getEntries();
        while (entries.hasMoreElements()) {
            ZipArchiveEntry entry = entries.nextElement();
            if (!entry.isDirectory()) {
                names.add(EpubPaths.normalizeSeparators(entry.getName()));
            }
        }
        return names;
    }

    public boolean contains(String path) {
        return findEntry(path).isPresent();
    }

    public byte[] readBytes(String path) {
        ZipArchiveEntry entry = requireEntry(path);
        try (InputStream in = zipFile.getInputStream(entry)) {
            return IOUtils.toByteArray(in);
        } catch (IOException e) {
            throw EpubError.ACCESS_ERROR.createException(e, path, e.getMessage());
        }
    }

    /**
     * Opens a stream over the entry's uncompressed bytes. The caller must close it.
     */
    public InputStream openStream(String path) {
        ZipArchiveEntry entry = requireEntry(path);
        try {
            return zipFile.getInputStream(entry);
        } catch (IOException e) {
            throw EpubError.ACCESS_ERROR.createException(e, path, e.getMessage());
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (owned) {
            log.debug("Closing EPUB archive {}", name);
            zipFile.close();
        }
    }

    private ZipArchiveEntry requireEntry(String path) {
        return findEntry(path)
                .orElseThrow(() -> EpubError.NOT_FOUND.createException("Entry '" + path + "'"));
    }

    private Optional<ZipArchiveEntry> findEntry(String path) {
        ensureOpen();
        String wanted = EpubPaths.normalizeSeparators(path);
        Enumeration<ZipArchiveEntry> entries = zipFile.getEntries();
        while (entries.hasMoreElements()) {
            ZipArchiveEntry entry = entries.nextElement();
            if (!entry.isDirectory() && EpubPaths.normalizeSeparators(entry.getName()).equals(wanted)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("EPUB archive " + name + " is closed");
        }
    }
}

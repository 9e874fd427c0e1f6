package org.epubkit.util;

import lombok.experimental.UtilityClass;

import java.util.ArrayDeque;
import java.util.Deque;

@UtilityClass
public class EpubPaths {

    public static String normalizeSeparators(String path) {
        return path == null ? "" : path.replace('\\', '/');
    }

    /**
     * Directory part of an archive path without trailing slash; "" for top-level entries.
     */
    public static String parentDirectory(String path) {
        String normalized = normalizeSeparators(path);
        int slash = normalized.lastIndexOf('/');
        return slash > 0 ? normalized.substring(0, slash) : "";
    }

    /**
     * Joins {@code href} onto {@code baseDirectory} and collapses "." and ".." segments.
     * A leading slash makes the href relative to the archive root. ".." never climbs above it.
     */
    public static String resolve(String baseDirectory, String href) {
        String normalizedHref = normalizeSeparators(href);
        String joined;
        if (normalizedHref.startsWith("/")) {
            joined = normalizedHref;
        } else {
            String base = normalizeSeparators(baseDirectory);
            joined = base.isEmpty() ? normalizedHref : base + "/" + normalizedHref;
        }
        return clean(joined);
    }

    static String clean(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }
}

package org.epubkit.options;

import lombok.Builder;
import lombok.Value;
import org.epubkit.model.Chapter;

import java.util.List;
import java.util.function.Predicate;

/**
 * Per-call settings for chapter queries, built from the defaults below plus an ordered list of
 * {@link EpubOption}s. Later options override earlier ones.
 */
@Value
@Builder(toBuilder = true)
public class EpubOptions {

    public static final EpubOptions DEFAULTS = EpubOptions.builder().build();

    @Builder.Default
    CancellationToken cancellation = CancellationToken.none();

    /** Reserved, no query reads it yet. */
    boolean includeCover;

    /** Reserved, no query reads it yet. */
    boolean includeMetadata;

    /** Null accepts every chapter. */
    Predicate<Chapter> chapterFilter;

    /** Maximum chapter size in bytes, 0 for no limit. */
    long maxContentLength;

    public static EpubOptions of(EpubOption... options) {
        return of(List.of(options));
    }

    public static EpubOptions of(List<EpubOption> options) {
        return DEFAULTS.with(options);
    }

    public EpubOptions with(List<EpubOption> options) {
        EpubOptionsBuilder builder = toBuilder();
        for (EpubOption option : options) {
            option.apply(builder);
        }
        return builder.build();
    }

    public boolean accepts(Chapter chapter) {
        return chapterFilter == null || chapterFilter.test(chapter);
    }

    public boolean exceedsMaxContentLength(long length) {
        return maxContentLength > 0 && length > maxContentLength;
    }

    public static EpubOption withCancellation(CancellationToken token) {
        return builder -> {
            if (token != null) {
                builder.cancellation(token);
            }
        };
    }

    public static EpubOption withCover() {
        return builder -> builder.includeCover(true);
    }

    public static EpubOption withMetadata() {
        return builder -> builder.includeMetadata(true);
    }

    public static EpubOption withChapterFilter(Predicate<Chapter> filter) {
        return builder -> builder.chapterFilter(filter);
    }

    public static EpubOption withMaxContentLength(long maxContentLength) {
        return builder -> builder.maxContentLength(maxContentLength);
    }
}

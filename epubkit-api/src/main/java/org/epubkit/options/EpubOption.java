package org.epubkit.options;

/**
 * A single adjustment applied on top of the default {@link EpubOptions}.
 */
@FunctionalInterface
public interface EpubOption {

    void apply(EpubOptions.EpubOptionsBuilder builder);
}

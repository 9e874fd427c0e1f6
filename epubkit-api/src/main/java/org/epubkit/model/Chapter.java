package org.epubkit.model;

import lombok.Builder;
import lombok.Value;

/**
 * A spine entry materialized as readable content. {@code order} is the 1-based spine
 * position, so skipped entries leave gaps.
 */
@Value
@Builder
public class Chapter {
    String title;
    String content;
    int order;
}

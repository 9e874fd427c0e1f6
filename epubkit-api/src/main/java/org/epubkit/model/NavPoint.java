package org.epubkit.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One entry of an NCX navigation map. {@code src} is kept exactly as written in the NCX,
 * relative to the NCX file and possibly carrying a fragment.
 */
@Value
@Builder
public class NavPoint {
    String id;
    String playOrder;
    String label;
    String src;
    @Builder.Default
    List<NavPoint> children = List.of();
}

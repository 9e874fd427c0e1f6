package org.epubkit.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TableOfContents {
    @Builder.Default
    String title = "";
    @Builder.Default
    List<NavPoint> navPoints = List.of();
}

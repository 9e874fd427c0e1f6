package org.epubkit.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SpineItemRef {
    String idref;
    // parsed, not used to gate chapter inclusion
    @Builder.Default
    boolean linear = true;
}

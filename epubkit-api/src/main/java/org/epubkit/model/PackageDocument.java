package org.epubkit.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PackageDocument {
    Metadata metadata;
    List<ManifestItem> manifest;
    List<SpineItemRef> spine;
}

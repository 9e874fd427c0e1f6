package org.epubkit.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class ManifestItem {
    String id;
    /** Relative to the directory of the package document. */
    String href;
    String mediaType;
    @Builder.Default
    List<String> properties = List.of();

    public boolean isHtml() {
        return mediaType != null && mediaType.contains("html");
    }

    public boolean hasProperty(String property) {
        return properties.contains(property);
    }
}

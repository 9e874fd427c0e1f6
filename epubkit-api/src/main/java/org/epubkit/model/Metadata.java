package org.epubkit.model;

import lombok.Builder;
import lombok.Value;

/**
 * Dublin Core fields from the package document. Missing elements are empty strings.
 */
@Value
@Builder
public class Metadata {

    public static final Metadata EMPTY = Metadata.builder().build();

    @Builder.Default
    String title = "";
    @Builder.Default
    String creator = "";
    @Builder.Default
    String subject = "";
    @Builder.Default
    String description = "";
    @Builder.Default
    String publisher = "";
    @Builder.Default
    String contributor = "";
    @Builder.Default
    String date = "";
    @Builder.Default
    String type = "";
    @Builder.Default
    String format = "";
    @Builder.Default
    String identifier = "";
    @Builder.Default
    String language = "";
    @Builder.Default
    String rights = "";
}

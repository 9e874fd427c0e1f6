package org.epubkit.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "epubkit.reader")
@Getter
@Setter
public class EpubReaderProperties {

    /**
     * Default maximum chapter size in bytes, applied before any per-call option. 0 disables the limit.
     */
    private long maxContentLength = 0;

    /**
     * Charset of zip entry names for archives without the UTF-8 flag or Unicode extra fields.
     */
    private String entryEncoding = "UTF-8";
}

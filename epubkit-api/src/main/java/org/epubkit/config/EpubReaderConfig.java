package org.epubkit.config;

import org.epubkit.service.EpubLibraryService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(EpubReaderProperties.class)
public class EpubReaderConfig {

    @Bean
    public EpubLibraryService epubLibraryService(EpubReaderProperties properties) {
        return new EpubLibraryService(properties);
    }
}

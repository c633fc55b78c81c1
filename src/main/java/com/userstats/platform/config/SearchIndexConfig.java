package com.userstats.platform.config;

import com.userstats.platform.model.IndexCapability;
import com.userstats.platform.repository.SearchIndexRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SearchIndexConfig {

    private static final Logger logger = LoggerFactory.getLogger(SearchIndexConfig.class);

    /**
     * Probed once; the result is fixed for the lifetime of the application.
     */
    @Bean
    public IndexCapability indexCapability(
            SearchIndexRepository searchIndexRepository,
            @Value("${userstats.index.enabled:true}") boolean enabled) {
        if (!enabled) {
            logger.info("Search index disabled by configuration, compound filters will scan");
            return IndexCapability.UNAVAILABLE;
        }
        return searchIndexRepository.detectCapability();
    }
}

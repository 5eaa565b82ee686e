package com.sandcastle.core.catalog;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogConfig {

    /**
     * Seeded catalog, shared process-wide.
     */
    @Bean
    @ConditionalOnMissingBean(ResourceCatalog.class)
    public ResourceCatalog resourceCatalog() {
        return new StaticResourceCatalog();
    }
}

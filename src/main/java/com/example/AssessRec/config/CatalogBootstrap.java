package com.example.AssessRec.config;

import com.example.AssessRec.model.CatalogStatus;
import com.example.AssessRec.service.CatalogIndexService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Builds the catalog index at startup when {@code recommender.catalog.build-on-startup=true}.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "recommender.catalog", name = "build-on-startup", havingValue = "true")
public class CatalogBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CatalogBootstrap.class);

    private final CatalogIndexService catalogIndexService;

    @Override
    public void run(ApplicationArguments args) {
        CatalogStatus status = catalogIndexService.build(true);
        log.info("Catalog index ready: {} records in {}", status.count(), status.store());
    }
}

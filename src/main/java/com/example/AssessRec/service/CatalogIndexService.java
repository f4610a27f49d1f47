package com.example.AssessRec.service;

import com.example.AssessRec.catalog.CatalogFileReader;
import com.example.AssessRec.config.RecommenderProperties;
import com.example.AssessRec.model.AssessmentRecord;
import com.example.AssessRec.model.CatalogEntry;
import com.example.AssessRec.model.CatalogStatus;
import com.example.AssessRec.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds the catalog index on explicit request. Queries never trigger a rebuild;
 * the caller decides when to call {@link #build}.
 */
@Service
public class CatalogIndexService {

    private static final Logger log = LoggerFactory.getLogger(CatalogIndexService.class);

    private final CatalogFileReader catalogFileReader;
    private final VectorIndex vectorIndex;
    private final Path catalogPath;

    public CatalogIndexService(CatalogFileReader catalogFileReader,
                               VectorIndex vectorIndex,
                               RecommenderProperties properties) {
        this.catalogFileReader = catalogFileReader;
        this.vectorIndex = vectorIndex;
        this.catalogPath = Path.of(properties.getCatalog().getPath());
    }

    public CatalogStatus build(boolean reset) {
        return build(catalogFileReader.read(catalogPath), reset);
    }

    public CatalogStatus build(List<CatalogEntry> entries, boolean reset) {
        log.info("Building catalog index from {} entries (reset={})", entries.size(), reset);
        List<AssessmentRecord> records = entries.stream().map(AssessmentRecord::fromEntry).toList();
        vectorIndex.build(records, reset);
        return status();
    }

    public CatalogStatus status() {
        boolean built = vectorIndex.isBuilt();
        return new CatalogStatus(built, built ? vectorIndex.count() : 0, vectorIndex.storeName());
    }

    public boolean isBuilt() {
        return vectorIndex.isBuilt();
    }
}

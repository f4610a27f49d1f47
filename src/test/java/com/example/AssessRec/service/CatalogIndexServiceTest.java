package com.example.AssessRec.service;

import com.example.AssessRec.catalog.CatalogFileReader;
import com.example.AssessRec.config.RecommenderProperties;
import com.example.AssessRec.model.CatalogStatus;
import com.example.AssessRec.repository.InMemoryVectorIndex;
import com.example.AssessRec.support.CatalogFixtures;
import com.example.AssessRec.support.TermHashEmbeddingProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogIndexServiceTest {

    @Mock
    private CatalogFileReader catalogFileReader;

    private CatalogIndexService service;

    @BeforeEach
    void setUp() {
        RecommenderProperties properties = new RecommenderProperties();
        properties.getCatalog().setPath("data/catalog.csv");
        service = new CatalogIndexService(catalogFileReader,
                new InMemoryVectorIndex(new TermHashEmbeddingProvider()), properties);
    }

    @Test
    @DisplayName("Status reports an unbuilt index before the first build")
    void statusBeforeBuild() {
        assertThat(service.status()).isEqualTo(new CatalogStatus(false, 0, "memory"));
        assertThat(service.isBuilt()).isFalse();
    }

    @Test
    @DisplayName("Building reads the configured catalog file and indexes every entry")
    void buildsFromConfiguredPath() {
        when(catalogFileReader.read(Path.of("data/catalog.csv"))).thenReturn(CatalogFixtures.sampleCatalog());

        CatalogStatus status = service.build(true);

        assertThat(status).isEqualTo(new CatalogStatus(true, 6, "memory"));
    }

    @Test
    @DisplayName("Appending keeps earlier records, reset replaces them")
    void appendAndReset() {
        service.build(CatalogFixtures.sampleCatalog(), true);
        service.build(CatalogFixtures.sampleCatalog().subList(0, 2), false);
        assertThat(service.status().count()).isEqualTo(8);

        service.build(CatalogFixtures.sampleCatalog().subList(0, 1), true);
        assertThat(service.status().count()).isEqualTo(1);
    }
}

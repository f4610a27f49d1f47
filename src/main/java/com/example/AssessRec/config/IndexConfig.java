package com.example.AssessRec.config;

import com.example.AssessRec.embedding.EmbeddingProvider;
import com.example.AssessRec.evaluation.MeanRecallAtKEvaluator;
import com.example.AssessRec.repository.InMemoryVectorIndex;
import com.example.AssessRec.repository.PgVectorCatalogRepository;
import com.example.AssessRec.repository.VectorIndex;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class IndexConfig {

    @Bean
    @ConditionalOnProperty(prefix = "recommender.index", name = "store", havingValue = "memory", matchIfMissing = true)
    public VectorIndex inMemoryVectorIndex(EmbeddingProvider embeddingProvider) {
        return new InMemoryVectorIndex(embeddingProvider);
    }

    @Bean
    @ConditionalOnProperty(prefix = "recommender.index", name = "store", havingValue = "pgvector")
    public VectorIndex pgVectorCatalogRepository(JdbcTemplate jdbcTemplate,
                                                 TransactionTemplate transactionTemplate,
                                                 EmbeddingProvider embeddingProvider,
                                                 RecommenderProperties properties) {
        return new PgVectorCatalogRepository(jdbcTemplate, transactionTemplate, embeddingProvider,
                properties.getIndex().getTableName());
    }

    @Bean
    public MeanRecallAtKEvaluator meanRecallAtKEvaluator(RecommenderProperties properties) {
        return new MeanRecallAtKEvaluator(properties.getEvaluation().getKValues());
    }
}

package com.example.AssessRec.repository;

import com.example.AssessRec.embedding.EmbeddingProvider;
import com.example.AssessRec.exception.CatalogIndexNotBuiltException;
import com.example.AssessRec.exception.EmbeddingDimensionMismatchException;
import com.example.AssessRec.model.AssessmentRecord;
import com.example.AssessRec.model.IndexedNeighbor;
import com.pgvector.PGvector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Catalog index stored in PostgreSQL with the pgvector extension.
 * Uses the cosine distance operator {@code <=>}; equal distances are ordered by the
 * ingestion ordinal so result lists are reproducible.
 */
public class PgVectorCatalogRepository implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(PgVectorCatalogRepository.class);

    private static final Pattern SAFE_TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final EmbeddingProvider embeddingProvider;
    private final String table;

    public PgVectorCatalogRepository(JdbcTemplate jdbcTemplate,
                                     TransactionTemplate transactionTemplate,
                                     EmbeddingProvider embeddingProvider,
                                     String tableName) {
        if (!SAFE_TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.embeddingProvider = embeddingProvider;
        this.table = tableName;
    }

    @Override
    public void build(List<AssessmentRecord> records, boolean reset) {
        List<float[]> vectors = embeddingProvider.encodeAll(
                records.stream().map(AssessmentRecord::fullText).toList());

        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS vector");
            jdbcTemplate.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        ordinal          BIGINT PRIMARY KEY,
                        record_id        TEXT NOT NULL,
                        name             TEXT,
                        category         TEXT,
                        description      TEXT,
                        skills_measured  TEXT,
                        job_suitability  TEXT,
                        experience_level TEXT,
                        duration         TEXT,
                        delivery_method  TEXT,
                        url              TEXT,
                        full_text        TEXT,
                        embedding        vector
                    )""".formatted(table));
            if (reset) {
                jdbcTemplate.execute("TRUNCATE TABLE " + table);
            }

            Integer storedDimension = storedDimension();
            long next = nextOrdinal();
            List<Object[]> rows = new ArrayList<>(records.size());
            for (int i = 0; i < records.size(); i++) {
                AssessmentRecord r = records.get(i);
                float[] vector = vectors.get(i);
                if (storedDimension == null) {
                    storedDimension = vector.length;
                } else if (vector.length != storedDimension) {
                    throw new EmbeddingDimensionMismatchException(storedDimension, vector.length);
                }
                rows.add(new Object[]{
                        next + i, r.id(), r.name(), r.category(), r.description(), r.skillsMeasured(),
                        r.jobSuitability(), r.experienceLevel(), r.duration(), r.deliveryMethod(),
                        r.url(), r.fullText(), new PGvector(vector)
                });
            }
            jdbcTemplate.batchUpdate("""
                    INSERT INTO %s (ordinal, record_id, name, category, description, skills_measured,
                                    job_suitability, experience_level, duration, delivery_method,
                                    url, full_text, embedding)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """.formatted(table), rows);
        });
        log.info("pgvector catalog index '{}' built with {} records (reset={})", table, records.size(), reset);
    }

    @Override
    public List<IndexedNeighbor> query(float[] vector, int k) {
        requireBuilt();
        if (k <= 0) {
            return List.of();
        }
        Integer dimension = storedDimension();
        if (dimension == null) {
            return List.of();
        }
        if (dimension != vector.length) {
            throw new EmbeddingDimensionMismatchException(dimension, vector.length);
        }

        PGvector queryVector = new PGvector(vector);
        String sql = """
                SELECT ordinal, record_id, name, category, description, skills_measured,
                       job_suitability, experience_level, duration, delivery_method, url, full_text,
                       embedding <=> ? AS distance
                FROM %s
                ORDER BY distance, ordinal
                LIMIT ?
                """.formatted(table);

        return jdbcTemplate.query(sql, ps -> {
            ps.setObject(1, queryVector);
            ps.setInt(2, k);
        }, new NeighborRowMapper());
    }

    @Override
    public int count() {
        requireBuilt();
        Integer count = jdbcTemplate.queryForObject("SELECT count(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    @Override
    public boolean isBuilt() {
        Boolean exists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM information_schema.tables WHERE table_name = ?)",
                Boolean.class, table.toLowerCase(Locale.ROOT));
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public String storeName() {
        return "pgvector:" + table;
    }

    private void requireBuilt() {
        if (!isBuilt()) {
            throw new CatalogIndexNotBuiltException(table);
        }
    }

    private Integer storedDimension() {
        List<Integer> dims = jdbcTemplate.queryForList(
                "SELECT vector_dims(embedding) FROM " + table + " LIMIT 1", Integer.class);
        return dims.isEmpty() ? null : dims.get(0);
    }

    private long nextOrdinal() {
        Long next = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(ordinal) + 1, 0) FROM " + table, Long.class);
        return next == null ? 0L : next;
    }

    private static class NeighborRowMapper implements RowMapper<IndexedNeighbor> {
        @Override
        public IndexedNeighbor mapRow(ResultSet rs, int rowNum) throws SQLException {
            AssessmentRecord record = new AssessmentRecord(
                    rs.getString("record_id"),
                    rs.getString("name"),
                    rs.getString("category"),
                    rs.getString("description"),
                    rs.getString("skills_measured"),
                    rs.getString("job_suitability"),
                    rs.getString("experience_level"),
                    rs.getString("duration"),
                    rs.getString("delivery_method"),
                    rs.getString("url"),
                    rs.getString("full_text")
            );
            return new IndexedNeighbor(record, rs.getDouble("distance"), rs.getLong("ordinal"));
        }
    }
}

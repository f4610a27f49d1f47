package com.example.AssessRec.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes predictions as {@code Query,Assessment_URL}, one row per (query, url) pair.
 * Rows of a query keep rank order; graders read them positionally.
 */
@Component
public class PredictionCsvWriter {

    private static final Logger log = LoggerFactory.getLogger(PredictionCsvWriter.class);

    private final CsvMapper csvMapper = new CsvMapper();

    public String toCsv(Map<String, List<String>> predictionsByQuery) {
        try {
            return writer().writeValueAsString(toRows(predictionsByQuery));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render predictions CSV", e);
        }
    }

    public Path write(Path file, Map<String, List<String>> predictionsByQuery) {
        List<PredictionRow> rows = toRows(predictionsByQuery);
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, writer().writeValueAsString(rows), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write predictions to " + file, e);
        }
        log.info("Saved {} predictions to {}", rows.size(), file);
        return file;
    }

    private ObjectWriter writer() {
        return csvMapper.writer(csvMapper.schemaFor(PredictionRow.class).withHeader())
                .with(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
    }

    private static List<PredictionRow> toRows(Map<String, List<String>> predictionsByQuery) {
        List<PredictionRow> rows = new ArrayList<>();
        predictionsByQuery.forEach((query, urls) -> {
            for (String url : urls) {
                if (url != null && !url.isBlank()) {
                    rows.add(new PredictionRow(query, url));
                }
            }
        });
        return rows;
    }

    @JsonPropertyOrder({"Query", "Assessment_URL"})
    record PredictionRow(
            @JsonProperty("Query") String query,
            @JsonProperty("Assessment_URL") String assessmentUrl
    ) {
    }
}

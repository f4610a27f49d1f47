package com.example.AssessRec.evaluation;

import com.example.AssessRec.exception.DatasetFormatException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads labeled queries (query -> relevant assessment urls) and unlabeled query lists.
 *
 * CSV layouts:
 *   - wide: {@code Query,Assessment_URLs} with a comma separated or JSON list cell
 *   - long: {@code Query,Assessment_URL}, one row per (query, url) pair
 * JSON layouts:
 *   - array of {@code {"query_id": ..., "assessment_urls": [...]}}
 *   - object {@code {"<query>": [...]}}
 */
@Component
@RequiredArgsConstructor
public class GroundTruthLoader {

    private static final Logger log = LoggerFactory.getLogger(GroundTruthLoader.class);

    private static final List<String> QUERY_COLUMNS = List.of("Query", "query_id", "query", "id");
    private static final List<String> URL_COLUMNS = List.of(
            "Assessment_URLs", "Assessment_URL", "assessment_urls", "assessment_url", "assessments");

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();

    public GroundTruthSet load(Path file) {
        Map<String, List<String>> raw = switch (extension(file)) {
            case "csv" -> readCsv(file);
            case "json" -> readJson(file);
            default -> throw new DatasetFormatException("Unsupported ground truth file: " + file);
        };
        GroundTruthSet groundTruth = GroundTruthSet.of(raw);
        log.info("Loaded {} labeled queries from {}", groundTruth.size(), file);
        return groundTruth;
    }

    /**
     * Query texts only, in first-seen order. Any url column is ignored.
     */
    public List<String> loadQueries(Path file) {
        Set<String> queries = new LinkedHashSet<>();
        switch (extension(file)) {
            case "csv" -> {
                for (Map<String, String> row : readCsvRows(file)) {
                    String query = firstPresent(row, QUERY_COLUMNS);
                    if (query != null) {
                        queries.add(query);
                    }
                }
            }
            case "json" -> {
                JsonNode root = readTree(file);
                if (root.isArray()) {
                    for (JsonNode item : root) {
                        String query = item.isTextual() ? item.asText() : firstText(item, QUERY_COLUMNS);
                        if (query != null && !query.isBlank()) {
                            queries.add(query.trim());
                        }
                    }
                } else if (root.isObject()) {
                    root.fieldNames().forEachRemaining(queries::add);
                }
            }
            default -> throw new DatasetFormatException("Unsupported query file: " + file);
        }
        log.info("Loaded {} queries from {}", queries.size(), file);
        return List.copyOf(queries);
    }

    private Map<String, List<String>> readCsv(Path file) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        int skipped = 0;
        for (Map<String, String> row : readCsvRows(file)) {
            String query = firstPresent(row, QUERY_COLUMNS);
            String urls = firstPresent(row, URL_COLUMNS);
            if (query == null || urls == null) {
                skipped++;
                continue;
            }
            result.computeIfAbsent(query, q -> new ArrayList<>()).addAll(splitUrls(urls));
        }
        if (skipped > 0) {
            log.warn("Skipped {} ground truth rows without a query or url in {}", skipped, file);
        }
        return result;
    }

    private Map<String, List<String>> readJson(Path file) {
        JsonNode root = readTree(file);
        Map<String, List<String>> result = new LinkedHashMap<>();
        if (root.isArray()) {
            int skipped = 0;
            for (JsonNode item : root) {
                String query = firstText(item, QUERY_COLUMNS);
                JsonNode urls = firstNode(item, URL_COLUMNS);
                if (query == null || query.isBlank() || urls == null) {
                    skipped++;
                    continue;
                }
                result.computeIfAbsent(query, q -> new ArrayList<>()).addAll(textValues(urls));
            }
            if (skipped > 0) {
                log.warn("Skipped {} ground truth entries without a query or urls in {}", skipped, file);
            }
        } else if (root.isObject()) {
            root.fields().forEachRemaining(e ->
                    result.computeIfAbsent(e.getKey(), q -> new ArrayList<>()).addAll(textValues(e.getValue())));
        } else {
            throw new DatasetFormatException("Ground truth JSON must be an array or an object: " + file);
        }
        return result;
    }

    private List<Map<String, String>> readCsvRows(Path file) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> rows =
                     csvMapper.readerForMapOf(String.class).with(schema).readValues(file.toFile())) {
            List<Map<String, String>> result = new ArrayList<>();
            while (rows.hasNext()) {
                Map<String, String> trimmed = new LinkedHashMap<>();
                rows.next().forEach((k, v) -> trimmed.put(stripBom(k).trim(), v));
                result.add(trimmed);
            }
            return result;
        } catch (IOException | RuntimeException e) {
            throw new DatasetFormatException("Failed to read CSV file " + file, e);
        }
    }

    private JsonNode readTree(Path file) {
        try {
            return objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new DatasetFormatException("Failed to read JSON file " + file, e);
        }
    }

    private List<String> splitUrls(String cell) {
        String value = cell.trim();
        if (value.startsWith("[")) {
            try {
                return textValues(objectMapper.readTree(value));
            } catch (IOException e) {
                throw new DatasetFormatException("Malformed JSON url list: " + value, e);
            }
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static List<String> textValues(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> values.add(n.asText()));
        } else if (!node.isNull()) {
            values.add(node.asText());
        }
        return values;
    }

    private static String firstPresent(Map<String, String> row, List<String> columns) {
        for (String column : columns) {
            String value = row.get(column);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String firstText(JsonNode item, List<String> fields) {
        JsonNode node = firstNode(item, fields);
        return node == null ? null : node.asText().trim();
    }

    private static JsonNode firstNode(JsonNode item, List<String> fields) {
        for (String field : fields) {
            JsonNode node = item.get(field);
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return null;
    }

    private static String stripBom(String header) {
        return header.startsWith("\uFEFF") ? header.substring(1) : header;
    }

    static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}

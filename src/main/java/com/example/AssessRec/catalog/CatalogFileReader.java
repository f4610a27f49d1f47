package com.example.AssessRec.catalog;

import com.example.AssessRec.exception.DatasetFormatException;
import com.example.AssessRec.model.CatalogEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the processed assessment catalog.
 * CSV needs a header row; a {@code full_text} column is ignored because the embedding text
 * is always recomputed from the record fields. JSON is an array of catalog objects whose
 * list-valued fields are joined with ", ".
 */
@Component
@RequiredArgsConstructor
public class CatalogFileReader {

    private static final Logger log = LoggerFactory.getLogger(CatalogFileReader.class);

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();

    public List<CatalogEntry> read(Path file) {
        if (!Files.exists(file)) {
            throw new DatasetFormatException("Catalog file not found: " + file);
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        List<CatalogEntry> entries;
        if (name.endsWith(".csv")) {
            entries = readCsv(file);
        } else if (name.endsWith(".json")) {
            entries = readJson(file);
        } else {
            throw new DatasetFormatException("Unsupported catalog file: " + file);
        }
        log.info("Loaded {} assessments from {}", entries.size(), file);
        return entries;
    }

    private List<CatalogEntry> readCsv(Path file) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<CatalogEntry> rows =
                     csvMapper.readerFor(CatalogEntry.class).with(schema).readValues(file.toFile())) {
            return rows.readAll();
        } catch (IOException | RuntimeException e) {
            throw new DatasetFormatException("Failed to read catalog CSV " + file, e);
        }
    }

    private List<CatalogEntry> readJson(Path file) {
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (!root.isArray()) {
                throw new DatasetFormatException("Catalog JSON must be an array: " + file);
            }
            List<CatalogEntry> entries = new ArrayList<>(root.size());
            for (JsonNode item : root) {
                if (item instanceof ObjectNode node) {
                    entries.add(objectMapper.treeToValue(joinLists(node), CatalogEntry.class));
                }
            }
            return entries;
        } catch (IOException e) {
            throw new DatasetFormatException("Failed to read catalog JSON " + file, e);
        }
    }

    private static ObjectNode joinLists(ObjectNode node) {
        ObjectNode copy = node.deepCopy();
        List<Map.Entry<String, JsonNode>> fields = new ArrayList<>();
        copy.fields().forEachRemaining(fields::add);
        for (Map.Entry<String, JsonNode> field : fields) {
            if (field.getValue().isArray()) {
                List<String> parts = new ArrayList<>();
                field.getValue().forEach(v -> parts.add(v.asText()));
                copy.put(field.getKey(), String.join(", ", parts));
            }
        }
        return copy;
    }
}

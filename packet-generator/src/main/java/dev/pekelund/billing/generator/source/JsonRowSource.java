package dev.pekelund.billing.generator.source;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import dev.pekelund.billing.rows.RawRow;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads raw billing rows exported from the source sheets. The input is either one JSON file or a
 * directory of {@code *.json} files read in file-name order; each file holds an array of objects
 * keyed by source column name, or an object with such an array under {@code "rows"}. Arrival
 * indexes run across all files in reading order.
 */
public class JsonRowSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonRowSource.class);
    private static final String ROWS_FIELD = "rows";

    private final ObjectReader reader;

    public JsonRowSource(ObjectMapper objectMapper) {
        // prices and ids keep the digits the sheet exported
        this.reader = Objects.requireNonNull(objectMapper, "objectMapper").reader()
            .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public List<RawRow> read(Path input) {
        Objects.requireNonNull(input, "input");
        if (!Files.exists(input)) {
            throw new RowSourceException("Row input " + input + " does not exist");
        }
        List<RawRow> rows = new ArrayList<>();
        for (Path file : files(input)) {
            int before = rows.size();
            readFile(file, rows);
            LOGGER.info("Read {} rows from {}", rows.size() - before, file);
        }
        return rows;
    }

    private List<Path> files(Path input) {
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        try (Stream<Path> entries = Files.list(input)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json"))
                .sorted()
                .toList();
        } catch (IOException ex) {
            throw new RowSourceException("Unable to list row files in " + input, ex);
        }
    }

    private void readFile(Path file, List<RawRow> rows) {
        JsonNode root;
        try (InputStream input = Files.newInputStream(file)) {
            root = reader.readTree(input);
        } catch (IOException ex) {
            throw new RowSourceException("Unable to parse row file " + file, ex);
        }
        JsonNode entries = root != null && root.isObject() ? root.get(ROWS_FIELD) : root;
        if (entries == null || !entries.isArray()) {
            throw new RowSourceException("Row file " + file + " does not contain an array of rows");
        }
        for (JsonNode entry : entries) {
            if (!entry.isObject()) {
                LOGGER.warn("Ignoring non-object entry in {}: {}", file, entry);
                continue;
            }
            rows.add(new RawRow(rows.size(), fields(entry)));
        }
    }

    private Map<String, Object> fields(JsonNode entry) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = entry.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> field = iterator.next();
            fields.put(field.getKey(), value(field.getValue()));
        }
        return fields;
    }

    private Object value(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return node.toString();
    }
}

package dev.pekelund.billing.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.billing.rows.CellValues;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Work requests that are billed elsewhere and must not produce packets. Loaded from a JSON file
 * of the form {@code {"exempted_work_requests": ["12345678", ...]}}.
 */
public final class ExemptionList {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExemptionList.class);

    static final String EXEMPTED_WORK_REQUESTS = "exempted_work_requests";

    private static final ExemptionList EMPTY = new ExemptionList(Set.of());

    private final Set<String> workRequests;

    private ExemptionList(Set<String> workRequests) {
        this.workRequests = Collections.unmodifiableSet(workRequests);
    }

    public static ExemptionList empty() {
        return EMPTY;
    }

    public static ExemptionList of(Collection<?> workRequests) {
        Set<String> normalized = new LinkedHashSet<>();
        if (workRequests != null) {
            for (Object value : workRequests) {
                String id = CellValues.workRequestId(value);
                if (id != null) {
                    normalized.add(id);
                }
            }
        }
        return normalized.isEmpty() ? EMPTY : new ExemptionList(normalized);
    }

    /**
     * Reads the exemption file. A missing or unreadable file, or one without the expected key,
     * yields an empty list so a broken exemption file never blocks billing.
     */
    public static ExemptionList load(Path path, ObjectMapper objectMapper) {
        if (path == null || !Files.exists(path)) {
            LOGGER.info("No exemption list found at {}; all work requests are eligible", path);
            return EMPTY;
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            JsonNode entries = root != null ? root.get(EXEMPTED_WORK_REQUESTS) : null;
            if (entries == null || !entries.isArray()) {
                LOGGER.warn("Exemption list {} has no '{}' array; ignoring it", path, EXEMPTED_WORK_REQUESTS);
                return EMPTY;
            }
            Set<Object> values = new LinkedHashSet<>();
            for (JsonNode entry : entries) {
                if (entry.isNumber()) {
                    values.add(entry.decimalValue());
                } else if (entry.isTextual()) {
                    values.add(entry.asText());
                }
            }
            ExemptionList list = of(values);
            LOGGER.info("Loaded {} exempted work requests from {}", list.size(), path);
            return list;
        } catch (IOException ex) {
            LOGGER.warn("Could not read exemption list {}; ignoring it", path, ex);
            return EMPTY;
        }
    }

    public boolean contains(String workRequest) {
        String id = CellValues.workRequestId(workRequest);
        return id != null && workRequests.contains(id);
    }

    public Set<String> workRequests() {
        return workRequests;
    }

    public int size() {
        return workRequests.size();
    }

    public boolean isEmpty() {
        return workRequests.isEmpty();
    }
}

package dev.pekelund.billing.rows;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One source row as delivered by the sheet extraction, keyed by the source column name.
 * Values may be strings, numbers or booleans and may be {@code null}.
 */
public record RawRow(long arrivalIndex, Map<String, Object> fields) {

    public RawRow {
        fields = fields != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(fields))
            : Map.of();
    }

    public Object get(String column) {
        return fields.get(column);
    }
}

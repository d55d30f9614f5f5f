package dev.pekelund.billing.rows;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites source rows into {@link CanonicalRow}s. Source sheets have renamed their columns over
 * time; every historical name maps to exactly one canonical column. Lookup is an exact,
 * case-sensitive match on the trimmed column name, and unknown columns are kept as descriptive
 * fields under their original name.
 *
 * <p>This is the only component that reads string-keyed row data. It never throws: a value that
 * cannot be read is left empty and the row validator rejects the row.
 */
public class ColumnSynonymNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ColumnSynonymNormalizer.class);

    private static final Map<String, String> DEFAULT_SYNONYMS = defaultSynonyms();

    private static final Set<String> TYPED_COLUMNS = Set.of(
        BillingColumns.WORK_REQUEST,
        BillingColumns.LOGGED_DATE,
        BillingColumns.SNAPSHOT_DATE,
        BillingColumns.UNITS_COMPLETED,
        BillingColumns.TOTAL_PRICE,
        BillingColumns.QUANTITY,
        BillingColumns.UNIT_OF_MEASURE,
        BillingColumns.CU,
        BillingColumns.CU_DESCRIPTION,
        BillingColumns.WORK_TYPE,
        BillingColumns.POLE,
        BillingColumns.FOREMAN,
        BillingColumns.DEPARTMENT,
        BillingColumns.SCOPE,
        BillingColumns.HELPER_FOREMAN,
        BillingColumns.HELPER_COMPLETED,
        BillingColumns.HELPER_DEPARTMENT,
        BillingColumns.HELPER_JOB);

    private final Map<String, String> synonyms;

    public ColumnSynonymNormalizer() {
        this(DEFAULT_SYNONYMS);
    }

    public ColumnSynonymNormalizer(Map<String, String> synonyms) {
        this.synonyms = Collections.unmodifiableMap(new LinkedHashMap<>(synonyms));
    }

    public static Map<String, String> defaultSynonymTable() {
        return DEFAULT_SYNONYMS;
    }

    public String canonicalName(String sourceColumn) {
        if (sourceColumn == null) {
            return null;
        }
        String trimmed = sourceColumn.trim();
        return synonyms.getOrDefault(trimmed, trimmed);
    }

    public CanonicalRow normalize(RawRow rawRow) {
        Map<String, Object> columns = canonicalColumns(rawRow);

        Object loggedDate = columns.get(BillingColumns.LOGGED_DATE);
        if (CellValues.date(loggedDate) == null) {
            loggedDate = columns.get(BillingColumns.SNAPSHOT_DATE);
        }

        CanonicalRow.Builder builder = CanonicalRow.builder()
            .arrivalIndex(rawRow.arrivalIndex())
            .workRequest(CellValues.workRequestId(columns.get(BillingColumns.WORK_REQUEST)))
            .loggedDate(CellValues.date(loggedDate))
            .snapshotDate(CellValues.date(columns.get(BillingColumns.SNAPSHOT_DATE)))
            .completed(CellValues.flag(columns.get(BillingColumns.UNITS_COMPLETED)))
            .totalPrice(CellValues.price(columns.get(BillingColumns.TOTAL_PRICE)))
            .quantity(CellValues.decimal(columns.get(BillingColumns.QUANTITY)))
            .unitOfMeasure(CellValues.text(columns.get(BillingColumns.UNIT_OF_MEASURE)))
            .cuCode(CellValues.text(columns.get(BillingColumns.CU)))
            .cuDescription(CellValues.text(columns.get(BillingColumns.CU_DESCRIPTION)))
            .workType(CellValues.text(columns.get(BillingColumns.WORK_TYPE)))
            .poleId(CellValues.text(columns.get(BillingColumns.POLE)))
            .foreman(CellValues.text(columns.get(BillingColumns.FOREMAN)))
            .department(CellValues.text(columns.get(BillingColumns.DEPARTMENT)))
            .scope(CellValues.text(columns.get(BillingColumns.SCOPE)))
            .helperForeman(CellValues.text(columns.get(BillingColumns.HELPER_FOREMAN)))
            .helperCompleted(CellValues.flag(columns.get(BillingColumns.HELPER_COMPLETED)))
            .helperDepartment(CellValues.text(columns.get(BillingColumns.HELPER_DEPARTMENT)))
            .helperJob(CellValues.text(columns.get(BillingColumns.HELPER_JOB)));

        for (Map.Entry<String, Object> entry : columns.entrySet()) {
            if (!TYPED_COLUMNS.contains(entry.getKey())) {
                builder.descriptive(entry.getKey(), CellValues.text(entry.getValue()));
            }
        }
        return builder.build();
    }

    private Map<String, Object> canonicalColumns(RawRow rawRow) {
        Map<String, Object> columns = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : rawRow.fields().entrySet()) {
            String canonical = canonicalName(entry.getKey());
            if (canonical == null || canonical.isEmpty()) {
                continue;
            }
            Object value = entry.getValue();
            Object existing = columns.get(canonical);
            // An alias never overwrites a populated canonical value.
            if (existing != null && CellValues.text(existing) != null) {
                if (value != null && LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Row {} has both '{}' and another alias of '{}'; keeping the first value",
                        rawRow.arrivalIndex(), entry.getKey(), canonical);
                }
                continue;
            }
            columns.put(canonical, value);
        }
        return columns;
    }

    private static Map<String, String> defaultSynonyms() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("Total Price", BillingColumns.TOTAL_PRICE);
        table.put("Redlined Total Price", BillingColumns.TOTAL_PRICE);
        table.put("Qty", BillingColumns.QUANTITY);
        table.put("# Units", BillingColumns.QUANTITY);
        table.put("Point #", BillingColumns.POLE);
        table.put("Point Number", BillingColumns.POLE);
        table.put("Billable Unit Code", BillingColumns.CU);
        table.put("BUC", BillingColumns.CU);
        table.put("UOM", BillingColumns.UNIT_OF_MEASURE);
        table.put("Unit of Measurement", BillingColumns.UNIT_OF_MEASURE);
        table.put("Unit Description", BillingColumns.CU_DESCRIPTION);
        table.put("Description", BillingColumns.CU_DESCRIPTION);
        table.put("Units Completed", BillingColumns.UNITS_COMPLETED);
        table.put("Scope ID", BillingColumns.SCOPE);
        return Collections.unmodifiableMap(table);
    }
}

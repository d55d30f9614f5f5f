package dev.pekelund.billing.grouping;

import dev.pekelund.billing.rows.CanonicalRow;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Rows billed together for one work request and week, in source arrival order.
 */
public record Packet(PacketKey key, List<CanonicalRow> rows) {

    public Packet {
        Objects.requireNonNull(key, "key");
        rows = rows != null ? List.copyOf(rows) : List.of();
    }

    public int rowCount() {
        return rows.size();
    }

    public BigDecimal totalPrice() {
        BigDecimal total = BigDecimal.ZERO.setScale(2);
        for (CanonicalRow row : rows) {
            if (row.totalPrice() != null) {
                total = total.add(row.totalPrice());
            }
        }
        return total;
    }

    /**
     * Foreman of the first row, used to label artifacts and history entries.
     */
    public String foreman() {
        return rows.stream()
            .map(CanonicalRow::foreman)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);
    }
}

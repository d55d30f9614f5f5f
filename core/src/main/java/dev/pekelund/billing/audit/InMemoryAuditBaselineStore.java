package dev.pekelund.billing.audit;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryAuditBaselineStore implements AuditBaselineStore {

    private final AtomicReference<AuditSummary> latest = new AtomicReference<>();

    public InMemoryAuditBaselineStore() {
    }

    public InMemoryAuditBaselineStore(AuditSummary initial) {
        latest.set(initial);
    }

    @Override
    public Optional<AuditSummary> loadPrevious() {
        return Optional.ofNullable(latest.get());
    }

    @Override
    public void save(AuditSummary summary) {
        latest.set(Objects.requireNonNull(summary, "summary"));
    }
}

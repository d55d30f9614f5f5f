package dev.pekelund.billing.audit;

import java.util.Optional;

/**
 * Keeps the summary of the most recent audit so the next run can report a trend.
 */
public interface AuditBaselineStore {

    Optional<AuditSummary> loadPrevious();

    void save(AuditSummary summary);
}

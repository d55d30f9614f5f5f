package dev.pekelund.billing.pipeline;

import dev.pekelund.billing.audit.AuditSummary;
import dev.pekelund.billing.grouping.HelperFallbackWarning;
import dev.pekelund.billing.grouping.PacketKey;
import dev.pekelund.billing.validation.RejectReason;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated result of one pipeline run.
 */
public record PipelineReport(
    String runId,
    int rowsRead,
    int rowsAccepted,
    Map<RejectReason, Integer> rejectedByReason,
    int exemptedRows,
    List<HelperFallbackWarning> warnings,
    List<PacketOutcome> outcomes,
    AuditSummary audit,
    boolean baselineSaved
) {

    public PipelineReport {
        Objects.requireNonNull(audit, "audit");
        EnumMap<RejectReason, Integer> rejected = new EnumMap<>(RejectReason.class);
        if (rejectedByReason != null) {
            rejected.putAll(rejectedByReason);
        }
        rejectedByReason = Collections.unmodifiableMap(rejected);
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    public int rowsRejected() {
        return rejectedByReason.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int rejected(RejectReason reason) {
        return rejectedByReason.getOrDefault(reason, 0);
    }

    public long count(PacketStatus status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }

    public Optional<PacketOutcome> outcome(PacketKey key) {
        return outcomes.stream().filter(outcome -> outcome.key().equals(key)).findFirst();
    }

    public boolean hasFailures() {
        return !baselineSaved || outcomes.stream().anyMatch(PacketOutcome::failed);
    }

    public String summaryLine() {
        String template = "run %s: %d rows read, %d accepted, %d rejected, %d exempted; %d packets (%d generated, "
            + "%d skipped, %d render failures, %d persistence failures); audit %s with %d anomalies (%s)";
        return template.formatted(runId, rowsRead, rowsAccepted, rowsRejected(), exemptedRows, outcomes.size(),
                count(PacketStatus.GENERATED), count(PacketStatus.SKIPPED), count(PacketStatus.RENDER_FAILED),
                count(PacketStatus.PERSISTENCE_FAILED), audit.riskLevel(), audit.anomalyCount(),
                audit.trend().direction());
    }
}

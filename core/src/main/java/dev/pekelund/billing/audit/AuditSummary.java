package dev.pekelund.billing.audit;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of one audit run. The latest summary is stored as the baseline for the next run's trend.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditSummary(
    @JsonFormat(shape = JsonFormat.Shape.STRING) Instant auditedAt,
    int rowsAudited,
    List<Anomaly> anomalies,
    RiskLevel riskLevel,
    AuditTrend trend,
    List<String> recommendations
) {

    public AuditSummary {
        Objects.requireNonNull(riskLevel, "riskLevel");
        anomalies = anomalies != null ? List.copyOf(anomalies) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public int anomalyCount() {
        return anomalies.size();
    }

    public long count(AnomalyKind kind) {
        return anomalies.stream().filter(anomaly -> anomaly.kind() == kind).count();
    }
}

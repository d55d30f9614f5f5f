package dev.pekelund.billing.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * Change of this run's findings against the previous run's stored summary.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditTrend(
    Integer previousAnomalyCount,
    RiskLevel previousRiskLevel,
    int issuesDelta,
    RiskDirection direction
) {

    public AuditTrend {
        Objects.requireNonNull(direction, "direction");
    }

    static AuditTrend firstRun(int anomalyCount) {
        return new AuditTrend(null, null, anomalyCount, RiskDirection.STABLE);
    }

    static AuditTrend between(AuditSummary previous, int anomalyCount, RiskLevel riskLevel) {
        int delta = anomalyCount - previous.anomalyCount();
        RiskDirection direction;
        if (delta > 0) {
            direction = RiskDirection.WORSENING;
        } else if (delta < 0) {
            direction = RiskDirection.IMPROVING;
        } else {
            int riskChange = riskLevel.compareTo(previous.riskLevel());
            direction = riskChange > 0 ? RiskDirection.WORSENING
                : riskChange < 0 ? RiskDirection.IMPROVING : RiskDirection.STABLE;
        }
        return new AuditTrend(previous.anomalyCount(), previous.riskLevel(), delta, direction);
    }
}

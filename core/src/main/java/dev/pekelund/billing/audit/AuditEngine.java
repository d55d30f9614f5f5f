package dev.pekelund.billing.audit;

import dev.pekelund.billing.config.PipelineConfig;
import dev.pekelund.billing.rows.CanonicalRow;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Statistical audit over the rows of one run. Flags rows whose price strays from the mean of their
 * work request, runs row integrity checks, classifies the overall risk and compares the result with
 * the previous run's summary.
 */
public class AuditEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(AuditEngine.class);

    private static final int MEAN_SCALE = 4;
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal priceVarianceThreshold;
    private final BigDecimal highSeverityDeviation;
    private final int highRiskAnomalyCount;
    private final Clock clock;

    public AuditEngine(PipelineConfig config, Clock clock) {
        this(config.priceVarianceThreshold(), config.highSeverityDeviation(), config.highRiskAnomalyCount(), clock);
    }

    public AuditEngine(double priceVarianceThreshold, double highSeverityDeviation, int highRiskAnomalyCount,
        Clock clock) {

        this.priceVarianceThreshold = BigDecimal.valueOf(priceVarianceThreshold);
        this.highSeverityDeviation = BigDecimal.valueOf(highSeverityDeviation);
        this.highRiskAnomalyCount = highRiskAnomalyCount;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Audits the rows without modifying them.
     *
     * @param previous summary of the previous run, or {@code null} on the first run
     */
    public AuditSummary audit(List<CanonicalRow> rows, AuditSummary previous) {
        List<Anomaly> anomalies = new ArrayList<>(detectPriceVariance(rows));
        anomalies.addAll(checkIntegrity(rows));

        RiskLevel riskLevel = classify(anomalies);
        AuditTrend trend = previous != null
            ? AuditTrend.between(previous, anomalies.size(), riskLevel)
            : AuditTrend.firstRun(anomalies.size());

        AuditSummary summary = new AuditSummary(clock.instant(), rows.size(), anomalies, riskLevel, trend,
            recommendations(anomalies, riskLevel));
        log(summary);
        return summary;
    }

    List<Anomaly> detectPriceVariance(List<CanonicalRow> rows) {
        Map<String, List<CanonicalRow>> byWorkRequest = new LinkedHashMap<>();
        for (CanonicalRow row : rows) {
            if (StringUtils.hasText(row.workRequest()) && row.totalPrice() != null) {
                byWorkRequest.computeIfAbsent(row.workRequest(), key -> new ArrayList<>()).add(row);
            }
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, List<CanonicalRow>> entry : byWorkRequest.entrySet()) {
            List<CanonicalRow> group = entry.getValue();
            if (group.size() < 2) {
                continue;
            }
            BigDecimal total = BigDecimal.ZERO;
            for (CanonicalRow row : group) {
                total = total.add(row.totalPrice());
            }
            BigDecimal mean = total.divide(BigDecimal.valueOf(group.size()), MEAN_SCALE, RoundingMode.HALF_UP);
            if (mean.signum() <= 0) {
                continue;
            }
            for (CanonicalRow row : group) {
                BigDecimal deviation = row.totalPrice().subtract(mean).abs()
                    .divide(mean, MEAN_SCALE, RoundingMode.HALF_UP);
                if (deviation.compareTo(priceVarianceThreshold) > 0) {
                    anomalies.add(Anomaly.priceVariance(entry.getKey(), row.arrivalIndex(), row.totalPrice(),
                        mean.setScale(2, RoundingMode.HALF_UP),
                        deviation.multiply(ONE_HUNDRED).setScale(2, RoundingMode.HALF_UP)));
                }
            }
        }
        return anomalies;
    }

    List<Anomaly> checkIntegrity(List<CanonicalRow> rows) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (CanonicalRow row : rows) {
            String workRequest = row.workRequest();
            if (!StringUtils.hasText(workRequest)) {
                anomalies.add(Anomaly.integrity(AnomalyKind.MISSING_WORK_REQUEST, null, row.arrivalIndex(),
                    row.totalPrice(), row.totalPrice(), "Row " + row.arrivalIndex() + " has no work request"));
            }
            if (row.totalPrice() != null && row.totalPrice().signum() < 0) {
                anomalies.add(Anomaly.integrity(AnomalyKind.NEGATIVE_PRICE, workRequest, row.arrivalIndex(),
                    row.totalPrice().abs(), row.totalPrice(),
                    "Negative price " + row.totalPrice().toPlainString() + " in WR# " + workRequest));
            }
            if (row.quantity() != null && row.quantity().signum() <= 0) {
                anomalies.add(Anomaly.integrity(AnomalyKind.ZERO_QUANTITY, workRequest, row.arrivalIndex(),
                    row.quantity(), row.totalPrice(),
                    "Zero or negative quantity " + row.quantity().toPlainString() + " in WR# " + workRequest));
            }
        }
        return anomalies;
    }

    RiskLevel classify(List<Anomaly> anomalies) {
        if (anomalies.isEmpty()) {
            return RiskLevel.LOW;
        }
        if (anomalies.size() > highRiskAnomalyCount) {
            return RiskLevel.HIGH;
        }
        BigDecimal highSeverityPercent = highSeverityDeviation.multiply(ONE_HUNDRED);
        boolean severe = anomalies.stream()
            .filter(anomaly -> anomaly.kind() == AnomalyKind.PRICE_VARIANCE)
            .anyMatch(anomaly -> anomaly.deviationPercent().compareTo(highSeverityPercent) > 0);
        return severe ? RiskLevel.HIGH : RiskLevel.MEDIUM;
    }

    private List<String> recommendations(List<Anomaly> anomalies, RiskLevel riskLevel) {
        List<String> recommendations = new ArrayList<>();
        switch (riskLevel) {
            case LOW -> recommendations.add("No issues detected. Continue monitoring.");
            case MEDIUM -> recommendations.add("Minor issues detected. Review flagged items.");
            case HIGH -> recommendations.add("Multiple or severe issues detected. Immediate review recommended.");
        }
        if (anomalies.stream().anyMatch(anomaly -> anomaly.kind() == AnomalyKind.PRICE_VARIANCE)) {
            recommendations.add("Review price anomalies for potential data entry errors.");
        }
        if (anomalies.stream().anyMatch(anomaly -> anomaly.kind() != AnomalyKind.PRICE_VARIANCE)) {
            recommendations.add("Address data consistency issues before processing.");
        }
        return recommendations;
    }

    private void log(AuditSummary summary) {
        AuditTrend trend = summary.trend();
        if (summary.riskLevel() == RiskLevel.HIGH) {
            LOGGER.warn("Billing audit: {} risk, {} anomalies in {} rows (delta {}, {})", summary.riskLevel(),
                summary.anomalyCount(), summary.rowsAudited(), trend.issuesDelta(), trend.direction());
        } else {
            LOGGER.info("Billing audit: {} risk, {} anomalies in {} rows (delta {}, {})", summary.riskLevel(),
                summary.anomalyCount(), summary.rowsAudited(), trend.issuesDelta(), trend.direction());
        }
    }
}

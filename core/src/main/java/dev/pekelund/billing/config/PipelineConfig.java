package dev.pekelund.billing.config;

import dev.pekelund.billing.grouping.GroupingMode;
import java.time.DayOfWeek;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Immutable options consumed by the billing pipeline. Built once at start-up and handed to each
 * component; the defaults match the values the weekly billing run has always used.
 */
public record PipelineConfig(
    boolean forceRegeneration,
    double priceVarianceThreshold,
    double highSeverityDeviation,
    int highRiskAnomalyCount,
    DayOfWeek weekEndingWeekday,
    boolean extendedChangeDetection,
    GroupingMode groupingMode,
    String placeholderCuCode,
    int workerThreads
) {

    public static final double DEFAULT_PRICE_VARIANCE_THRESHOLD = 0.5d;
    public static final double DEFAULT_HIGH_SEVERITY_DEVIATION = 0.75d;
    public static final int DEFAULT_HIGH_RISK_ANOMALY_COUNT = 3;
    public static final DayOfWeek DEFAULT_WEEK_ENDING_WEEKDAY = DayOfWeek.SUNDAY;
    public static final String DEFAULT_PLACEHOLDER_CU_CODE = "#NO MATCH";

    public PipelineConfig {
        Objects.requireNonNull(weekEndingWeekday, "weekEndingWeekday");
        Objects.requireNonNull(groupingMode, "groupingMode");
        if (!(priceVarianceThreshold > 0d) || Double.isInfinite(priceVarianceThreshold)) {
            throw new InvalidConfigurationException(
                "priceVarianceThreshold must be a positive fraction but was " + priceVarianceThreshold);
        }
        if (!(highSeverityDeviation > 0d) || Double.isInfinite(highSeverityDeviation)) {
            throw new InvalidConfigurationException(
                "highSeverityDeviation must be a positive fraction but was " + highSeverityDeviation);
        }
        if (highRiskAnomalyCount < 0) {
            throw new InvalidConfigurationException(
                "highRiskAnomalyCount must not be negative but was " + highRiskAnomalyCount);
        }
        if (!StringUtils.hasText(placeholderCuCode)) {
            throw new InvalidConfigurationException("placeholderCuCode must not be blank");
        }
        if (workerThreads < 1) {
            throw new InvalidConfigurationException("workerThreads must be at least 1 but was " + workerThreads);
        }
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .forceRegeneration(forceRegeneration)
            .priceVarianceThreshold(priceVarianceThreshold)
            .highSeverityDeviation(highSeverityDeviation)
            .highRiskAnomalyCount(highRiskAnomalyCount)
            .weekEndingWeekday(weekEndingWeekday)
            .extendedChangeDetection(extendedChangeDetection)
            .groupingMode(groupingMode)
            .placeholderCuCode(placeholderCuCode)
            .workerThreads(workerThreads);
    }

    public static final class Builder {

        private boolean forceRegeneration;
        private double priceVarianceThreshold = DEFAULT_PRICE_VARIANCE_THRESHOLD;
        private double highSeverityDeviation = DEFAULT_HIGH_SEVERITY_DEVIATION;
        private int highRiskAnomalyCount = DEFAULT_HIGH_RISK_ANOMALY_COUNT;
        private DayOfWeek weekEndingWeekday = DEFAULT_WEEK_ENDING_WEEKDAY;
        private boolean extendedChangeDetection;
        private GroupingMode groupingMode = GroupingMode.BOTH;
        private String placeholderCuCode = DEFAULT_PLACEHOLDER_CU_CODE;
        private int workerThreads = Math.max(1, Runtime.getRuntime().availableProcessors());

        private Builder() {
        }

        public Builder forceRegeneration(boolean forceRegeneration) {
            this.forceRegeneration = forceRegeneration;
            return this;
        }

        public Builder priceVarianceThreshold(double priceVarianceThreshold) {
            this.priceVarianceThreshold = priceVarianceThreshold;
            return this;
        }

        public Builder highSeverityDeviation(double highSeverityDeviation) {
            this.highSeverityDeviation = highSeverityDeviation;
            return this;
        }

        public Builder highRiskAnomalyCount(int highRiskAnomalyCount) {
            this.highRiskAnomalyCount = highRiskAnomalyCount;
            return this;
        }

        public Builder weekEndingWeekday(DayOfWeek weekEndingWeekday) {
            this.weekEndingWeekday = weekEndingWeekday;
            return this;
        }

        public Builder extendedChangeDetection(boolean extendedChangeDetection) {
            this.extendedChangeDetection = extendedChangeDetection;
            return this;
        }

        public Builder groupingMode(GroupingMode groupingMode) {
            this.groupingMode = groupingMode;
            return this;
        }

        public Builder placeholderCuCode(String placeholderCuCode) {
            this.placeholderCuCode = placeholderCuCode;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(forceRegeneration, priceVarianceThreshold, highSeverityDeviation,
                highRiskAnomalyCount, weekEndingWeekday, extendedChangeDetection, groupingMode, placeholderCuCode,
                workerThreads);
        }
    }
}

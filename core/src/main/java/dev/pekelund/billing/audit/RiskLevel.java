package dev.pekelund.billing.audit;

/**
 * Coarse classification of a run's findings, ordered from least to most severe.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}

package dev.pekelund.billing.audit;

public enum RiskDirection {
    IMPROVING,
    STABLE,
    WORSENING
}

package dev.pekelund.billing.decision;

public enum Decision {
    GENERATE,
    SKIP
}

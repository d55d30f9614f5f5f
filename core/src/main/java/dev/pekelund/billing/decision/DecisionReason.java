package dev.pekelund.billing.decision;

public enum DecisionReason {
    NEW_PACKET(Decision.GENERATE),
    CONTENT_CHANGED(Decision.GENERATE),
    ARTIFACT_MISSING(Decision.GENERATE),
    FORCED(Decision.GENERATE),
    UNCHANGED(Decision.SKIP);

    private final Decision decision;

    DecisionReason(Decision decision) {
        this.decision = decision;
    }

    public Decision decision() {
        return decision;
    }
}

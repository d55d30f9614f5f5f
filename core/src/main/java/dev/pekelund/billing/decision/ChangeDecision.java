package dev.pekelund.billing.decision;

import java.util.Objects;

public record ChangeDecision(Decision decision, DecisionReason reason) {

    public ChangeDecision {
        Objects.requireNonNull(reason, "reason");
        if (decision != reason.decision()) {
            throw new IllegalArgumentException(reason + " does not lead to " + decision);
        }
    }

    public static ChangeDecision of(DecisionReason reason) {
        return new ChangeDecision(reason.decision(), reason);
    }

    public boolean shouldGenerate() {
        return decision == Decision.GENERATE;
    }
}

package dev.pekelund.billing.decision;

import dev.pekelund.billing.fingerprint.Fingerprint;
import dev.pekelund.billing.grouping.PacketKey;
import dev.pekelund.billing.history.HistoryRecord;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Decides whether a packet's artifact must be regenerated. A packet is skipped only when its
 * fingerprint matches history, the recorded artifact still exists and regeneration is not forced.
 */
public class ChangeDecisionEngine {

    private final boolean forceRegeneration;
    private final ArtifactLocator artifactLocator;

    public ChangeDecisionEngine(boolean forceRegeneration, ArtifactLocator artifactLocator) {
        this.forceRegeneration = forceRegeneration;
        this.artifactLocator = Objects.requireNonNull(artifactLocator, "artifactLocator");
    }

    public ChangeDecision decide(PacketKey key, Fingerprint fingerprint, Map<String, HistoryRecord> history) {
        return decide(fingerprint, history.get(key.id()));
    }

    public ChangeDecision decide(Fingerprint fingerprint, HistoryRecord previous) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        if (previous == null) {
            return ChangeDecision.of(DecisionReason.NEW_PACKET);
        }
        if (!fingerprint.value().equals(previous.fingerprint())) {
            return ChangeDecision.of(DecisionReason.CONTENT_CHANGED);
        }
        if (!StringUtils.hasText(previous.artifactRef()) || !artifactLocator.exists(previous.artifactRef())) {
            return ChangeDecision.of(DecisionReason.ARTIFACT_MISSING);
        }
        if (forceRegeneration) {
            return ChangeDecision.of(DecisionReason.FORCED);
        }
        return ChangeDecision.of(DecisionReason.UNCHANGED);
    }
}

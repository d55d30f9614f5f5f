package dev.pekelund.billing.pipeline;

import dev.pekelund.billing.decision.DecisionReason;
import dev.pekelund.billing.grouping.PacketKey;
import java.util.Objects;

/**
 * What happened to one packet during a run. {@code reason} is absent when history could not be
 * read and no decision was taken.
 */
public record PacketOutcome(
    PacketKey key,
    PacketStatus status,
    DecisionReason reason,
    String fingerprint,
    String artifactRef,
    String detail
) {

    public PacketOutcome {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(status, "status");
    }

    static PacketOutcome generated(PacketKey key, DecisionReason reason, String fingerprint, String artifactRef) {
        return new PacketOutcome(key, PacketStatus.GENERATED, reason, fingerprint, artifactRef, null);
    }

    static PacketOutcome skipped(PacketKey key, DecisionReason reason, String fingerprint, String artifactRef) {
        return new PacketOutcome(key, PacketStatus.SKIPPED, reason, fingerprint, artifactRef, null);
    }

    static PacketOutcome renderFailed(PacketKey key, DecisionReason reason, String fingerprint, String detail) {
        return new PacketOutcome(key, PacketStatus.RENDER_FAILED, reason, fingerprint, null, detail);
    }

    static PacketOutcome persistenceFailed(PacketKey key, DecisionReason reason, String fingerprint,
        String artifactRef, String detail) {

        return new PacketOutcome(key, PacketStatus.PERSISTENCE_FAILED, reason, fingerprint, artifactRef, detail);
    }

    public boolean failed() {
        return status == PacketStatus.RENDER_FAILED || status == PacketStatus.PERSISTENCE_FAILED;
    }
}

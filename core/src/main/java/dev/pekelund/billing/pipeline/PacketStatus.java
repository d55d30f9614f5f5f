package dev.pekelund.billing.pipeline;

public enum PacketStatus {
    GENERATED,
    SKIPPED,
    RENDER_FAILED,
    PERSISTENCE_FAILED
}

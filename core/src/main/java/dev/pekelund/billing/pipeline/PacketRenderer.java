package dev.pekelund.billing.pipeline;

import dev.pekelund.billing.fingerprint.Fingerprint;
import dev.pekelund.billing.grouping.Packet;

/**
 * Turns a packet into its downstream artifact. Called only for packets whose decision is
 * GENERATE, possibly from several worker threads at once.
 */
@FunctionalInterface
public interface PacketRenderer {

    /**
     * @throws PacketRenderingException when the artifact could not be produced; history is then
     *     left untouched so the packet is retried on the next run
     */
    RenderedArtifact render(Packet packet, Fingerprint fingerprint);
}

package dev.pekelund.billing.grouping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Packets in the order their first row arrived, plus the structural warnings raised while grouping.
 */
public record GroupingResult(List<Packet> packets, List<HelperFallbackWarning> warnings, int exemptedRows) {

    public GroupingResult {
        packets = packets != null ? List.copyOf(packets) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public Map<PacketKey, Packet> asMap() {
        Map<PacketKey, Packet> byKey = new LinkedHashMap<>();
        for (Packet packet : packets) {
            byKey.put(packet.key(), packet);
        }
        return Collections.unmodifiableMap(byKey);
    }

    public Optional<Packet> find(PacketKey key) {
        return packets.stream().filter(packet -> packet.key().equals(key)).findFirst();
    }
}

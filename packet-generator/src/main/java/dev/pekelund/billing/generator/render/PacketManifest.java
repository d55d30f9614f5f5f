package dev.pekelund.billing.generator.render;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pekelund.billing.grouping.Packet;
import dev.pekelund.billing.rows.CanonicalRow;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * JSON document written for a generated packet.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
record PacketManifest(
    String packetId,
    String workRequest,
    LocalDate weekEnding,
    String helperForeman,
    String foreman,
    String fingerprint,
    @JsonFormat(shape = JsonFormat.Shape.STRING) Instant generatedAt,
    int rowCount,
    BigDecimal totalPrice,
    List<Line> lines
) {

    static PacketManifest of(Packet packet, String fingerprint, Instant generatedAt) {
        List<Line> lines = packet.rows().stream().map(Line::of).toList();
        return new PacketManifest(packet.key().id(), packet.key().workRequest(), packet.key().weekEnding(),
            packet.key().helperForeman(), packet.foreman(), fingerprint, generatedAt, packet.rowCount(),
            packet.totalPrice(), lines);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Line(
        LocalDate loggedDate,
        String cu,
        String cuDescription,
        String workType,
        String poleId,
        BigDecimal quantity,
        String unitOfMeasure,
        BigDecimal totalPrice
    ) {

        static Line of(CanonicalRow row) {
            return new Line(row.loggedDate(), row.cuCode(), row.cuDescription(), row.workType(), row.poleId(),
                row.quantity(), row.unitOfMeasure(), row.totalPrice());
        }
    }
}

package dev.pekelund.billing.fingerprint;

import static dev.pekelund.billing.BillingFixtures.canonicalRow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.billing.grouping.Packet;
import dev.pekelund.billing.grouping.PacketKey;
import dev.pekelund.billing.rows.CanonicalRow;
import dev.pekelund.billing.rows.CellValues;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

class FingerprintEngineTest {

    private static final LocalDate LOGGED = LocalDate.of(2025, 8, 1);
    private static final PacketKey KEY = PacketKey.primary("90093002", LocalDate.of(2025, 8, 3));

    private final FingerprintEngine engine = new FingerprintEngine(false);

    @Test
    void sameContentAlwaysHashesTheSame() {
        Packet packet = packet(canonicalRow(1, "90093002", LOGGED, "1250.00").build());

        Fingerprint first = engine.fingerprint(packet);

        assertThat(engine.fingerprint(packet)).isEqualTo(first);
        assertThat(new FingerprintEngine(false).fingerprint(packet)).isEqualTo(first);
        assertThat(first.value()).hasSize(Fingerprint.LENGTH).matches("[0-9a-f]+");
    }

    @Test
    void currencyFormattingDoesNotChangeTheFingerprint() {
        List<Fingerprint> fingerprints = Stream.of("$1,250.00", "1250.00", "$1250", 1250.0d)
            .map(price -> engine.fingerprint(packet(canonicalRow(1, "90093002", LOGGED, "1")
                .totalPrice(CellValues.price(price))
                .build())))
            .toList();

        assertThat(fingerprints).containsOnly(fingerprints.get(0));
        Fingerprint different = engine.fingerprint(packet(canonicalRow(1, "90093002", LOGGED, "1500.00").build()));
        assertThat(different).isNotEqualTo(fingerprints.get(0));
    }

    @Test
    void completionFlagChangesTheFingerprint() {
        CanonicalRow completed = canonicalRow(1, "90093002", LOGGED, "100").build();
        CanonicalRow notCompleted = canonicalRow(1, "90093002", LOGGED, "100").completed(false).build();

        assertThat(engine.fingerprint(packet(completed))).isNotEqualTo(engine.fingerprint(packet(notCompleted)));
    }

    @Test
    void descriptiveAndArrivalDetailsDoNotCount() {
        CanonicalRow original = canonicalRow(1, "90093002", LOGGED, "100").build();
        CanonicalRow reworded = canonicalRow(42, "90093002", LOGGED, "100")
            .cuDescription("Anchor, manual")
            .poleId("P-9")
            .descriptive("Notes", "new comment")
            .build();

        assertThat(engine.fingerprint(packet(reworded))).isEqualTo(engine.fingerprint(packet(original)));
    }

    @Test
    void extendedDetectionAlsoTracksForemanChanges() {
        CanonicalRow jane = canonicalRow(1, "90093002", LOGGED, "100").build();
        CanonicalRow john = canonicalRow(1, "90093002", LOGGED, "100").foreman("John Roe").build();
        FingerprintEngine extended = new FingerprintEngine(true);

        assertThat(engine.fingerprint(packet(jane))).isEqualTo(engine.fingerprint(packet(john)));
        assertThat(extended.fingerprint(packet(jane))).isNotEqualTo(extended.fingerprint(packet(john)));
    }

    @Test
    void rowOrderIsPartOfTheContent() {
        CanonicalRow a = canonicalRow(1, "90093002", LOGGED, "100").build();
        CanonicalRow b = canonicalRow(2, "90093002", LOGGED, "200").build();

        assertThat(engine.fingerprint(packet(a, b))).isNotEqualTo(engine.fingerprint(packet(b, a)));
    }

    @Test
    void rejectsMalformedFingerprintValues() {
        assertThatThrownBy(() -> new Fingerprint("ABC")).isInstanceOf(IllegalArgumentException.class);
    }

    private static Packet packet(CanonicalRow... rows) {
        return new Packet(KEY, List.of(rows));
    }
}

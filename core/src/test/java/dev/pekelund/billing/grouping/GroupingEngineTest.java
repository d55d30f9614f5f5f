package dev.pekelund.billing.grouping;

import static dev.pekelund.billing.BillingFixtures.canonicalRow;
import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.billing.rows.CanonicalRow;
import dev.pekelund.billing.validation.ExemptionList;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class GroupingEngineTest {

    private static final LocalDate FRIDAY = LocalDate.of(2025, 8, 1);
    private static final LocalDate SUNDAY = LocalDate.of(2025, 8, 3);
    private static final LocalDate NEXT_TUESDAY = LocalDate.of(2025, 8, 5);

    private final GroupingEngine engine = new GroupingEngine(DayOfWeek.SUNDAY, GroupingMode.BOTH, ExemptionList.empty());

    @Test
    void workRequestSpanningTwoWeeksYieldsTwoPackets() {
        GroupingResult result = engine.group(List.of(
            canonicalRow(1, "90093002", FRIDAY, "100").build(),
            canonicalRow(2, "90093002", SUNDAY, "200").build(),
            canonicalRow(3, "90093002", NEXT_TUESDAY, "300").build()));

        assertThat(result.packets()).extracting(packet -> packet.key().id())
            .containsExactly("90093002|080325", "90093002|081025");
        Packet first = result.find(PacketKey.primary("90093002", SUNDAY)).orElseThrow();
        assertThat(first.rows()).extracting(CanonicalRow::arrivalIndex).containsExactly(1L, 2L);
        assertThat(first.totalPrice()).isEqualByComparingTo("300");
        assertThat(first.rowCount()).isEqualTo(2);
    }

    @Test
    void everyRowOfAPacketSharesItsKey() {
        GroupingResult result = engine.group(List.of(
            canonicalRow(1, "A", FRIDAY, "1").build(),
            canonicalRow(2, "B", FRIDAY, "1").build(),
            canonicalRow(3, "A", NEXT_TUESDAY, "1").build(),
            canonicalRow(4, "A", SUNDAY, "1").build()));

        for (Packet packet : result.packets()) {
            for (CanonicalRow row : packet.rows()) {
                assertThat(row.workRequest()).isEqualTo(packet.key().workRequest());
                assertThat(row.loggedDate().with(java.time.temporal.TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY)))
                    .isEqualTo(packet.key().weekEnding());
            }
        }
        assertThat(result.packets()).extracting(packet -> packet.key().id())
            .containsExactly("A|080325", "B|080325", "A|081025");
    }

    @Test
    void helperRowWithBothIdsGoesToItsOwnPacket() {
        CanonicalRow helper = canonicalRow(2, "90093002", FRIDAY, "80")
            .helperForeman("Bob Smith")
            .helperCompleted(true)
            .helperDepartment("500")
            .helperJob("J-77")
            .build();

        GroupingResult result = engine.group(List.of(canonicalRow(1, "90093002", FRIDAY, "100").build(), helper));

        assertThat(result.packets()).hasSize(2);
        Packet helperPacket = result.find(PacketKey.helper("90093002", SUNDAY, "Bob Smith")).orElseThrow();
        assertThat(helperPacket.rows()).containsExactly(helper);
        assertThat(helperPacket.key().id()).isEqualTo("90093002|080325|HELPER|Bob Smith");
        assertThat(result.find(PacketKey.primary("90093002", SUNDAY)).orElseThrow().rows())
            .extracting(CanonicalRow::arrivalIndex).containsExactly(1L);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void helperRowMissingJobFallsBackToPrimaryWithWarning() {
        CanonicalRow helper = canonicalRow(2, "90093002", FRIDAY, "80")
            .helperForeman("Bob Smith")
            .helperCompleted(true)
            .helperDepartment("500")
            .build();

        GroupingResult result = engine.group(List.of(canonicalRow(1, "90093002", FRIDAY, "100").build(), helper));

        assertThat(result.packets()).hasSize(1);
        assertThat(result.packets().get(0).rows()).extracting(CanonicalRow::arrivalIndex).containsExactly(1L, 2L);
        assertThat(result.warnings()).singleElement().satisfies(warning -> {
            assertThat(warning.arrivalIndex()).isEqualTo(2L);
            assertThat(warning.missingJob()).isTrue();
            assertThat(warning.missingDepartment()).isFalse();
            assertThat(warning.message()).contains("Helper Job #").doesNotContain("Helper Dept #");
        });
    }

    @Test
    void helperNameWithoutCompletionIsNotAHelperCandidate() {
        CanonicalRow row = canonicalRow(1, "1", FRIDAY, "10")
            .helperForeman("Bob Smith")
            .helperCompleted(false)
            .helperDepartment("500")
            .helperJob("J-77")
            .build();

        GroupingResult result = engine.group(List.of(row));

        assertThat(result.packets()).singleElement().satisfies(packet -> assertThat(packet.key().isHelper()).isFalse());
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void primaryModeKeepsHelperRowsInThePrimaryPacket() {
        GroupingEngine primaryOnly = new GroupingEngine(DayOfWeek.SUNDAY, GroupingMode.PRIMARY, ExemptionList.empty());
        CanonicalRow helper = canonicalRow(2, "1", FRIDAY, "80")
            .helperForeman("Bob Smith")
            .helperCompleted(true)
            .helperDepartment("500")
            .helperJob("J-77")
            .build();

        GroupingResult result = primaryOnly.group(List.of(canonicalRow(1, "1", FRIDAY, "10").build(), helper));

        assertThat(result.packets()).singleElement()
            .satisfies(packet -> assertThat(packet.rowCount()).isEqualTo(2));
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void exemptedWorkRequestsAreSkippedAndCounted() {
        GroupingEngine withExemptions = new GroupingEngine(DayOfWeek.SUNDAY, GroupingMode.BOTH,
            ExemptionList.of(List.of("12345678.0")));

        GroupingResult result = withExemptions.group(List.of(
            canonicalRow(1, "12345678", FRIDAY, "10").build(),
            canonicalRow(2, "90093002", FRIDAY, "10").build(),
            canonicalRow(3, "12345678", NEXT_TUESDAY, "10").build()));

        assertThat(result.exemptedRows()).isEqualTo(2);
        assertThat(result.packets()).extracting(packet -> packet.key().workRequest()).containsExactly("90093002");
    }

    @Test
    void configurableWeekEndingWeekday() {
        GroupingEngine saturdayWeeks = new GroupingEngine(DayOfWeek.SATURDAY, GroupingMode.BOTH, ExemptionList.empty());

        GroupingResult result = saturdayWeeks.group(List.of(canonicalRow(1, "1", SUNDAY, "10").build()));

        assertThat(result.packets().get(0).key().weekEnding()).isEqualTo(LocalDate.of(2025, 8, 9));
    }

    @Test
    void packetTotalsSumRowPrices() {
        Packet packet = new Packet(PacketKey.primary("1", SUNDAY), List.of(
            canonicalRow(1, "1", FRIDAY, "10.25").build(),
            canonicalRow(2, "1", FRIDAY, "0.75").build()));

        assertThat(packet.totalPrice()).isEqualTo(new BigDecimal("11.00"));
        assertThat(packet.foreman()).isEqualTo("Jane Doe");
    }
}

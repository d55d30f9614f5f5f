package dev.pekelund.billing.validation;

import static dev.pekelund.billing.BillingFixtures.canonicalRow;
import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.billing.rows.CanonicalRow;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class RowValidatorTest {

    private static final LocalDate LOGGED = LocalDate.of(2025, 8, 1);

    private final RowValidator validator = new RowValidator("#NO MATCH");

    @Test
    void acceptsCompleteBillableRow() {
        ValidationResult result = validator.validate(canonicalRow(1, "90093002", LOGGED, "250.00").build());

        assertThat(result.accepted()).isTrue();
        assertThat(result.reason()).isNull();
    }

    @Test
    void rejectsEachRuleWithItsOwnReason() {
        assertThat(validator.validate(canonicalRow(1, null, LOGGED, "1").build()).reason())
            .isEqualTo(RejectReason.MISSING_WORK_REQUEST);
        assertThat(validator.validate(canonicalRow(1, "1", null, "1").build()).reason())
            .isEqualTo(RejectReason.MISSING_OR_INVALID_DATE);
        assertThat(validator.validate(canonicalRow(1, "1", LOGGED, "1").completed(false).build()).reason())
            .isEqualTo(RejectReason.NOT_COMPLETED);
        assertThat(validator.validate(canonicalRow(1, "1", LOGGED, "0.00").build()).reason())
            .isEqualTo(RejectReason.NON_POSITIVE_PRICE);
        assertThat(validator.validate(canonicalRow(1, "1", LOGGED, "1").totalPrice(null).build()).reason())
            .isEqualTo(RejectReason.NON_POSITIVE_PRICE);
        assertThat(validator.validate(canonicalRow(1, "1", LOGGED, "1").cuCode("#no match").build()).reason())
            .isEqualTo(RejectReason.PLACEHOLDER_CU);
    }

    @Test
    void firstFailingRuleDecidesTheReason() {
        CanonicalRow row = canonicalRow(1, "1", null, "-5")
            .completed(false)
            .build();

        assertThat(validator.validate(row).reason()).isEqualTo(RejectReason.MISSING_OR_INVALID_DATE);
    }

    @Test
    void everyRowIsEitherAcceptedOrRejectedWithAReason() {
        List<CanonicalRow> rows = List.of(
            canonicalRow(1, "1", LOGGED, "10").build(),
            canonicalRow(2, " ", LOGGED, "10").build(),
            canonicalRow(3, "1", LOGGED, "-10").build(),
            CanonicalRow.builder().arrivalIndex(4).totalPrice(BigDecimal.TEN).build(),
            CanonicalRow.builder().arrivalIndex(5).build());

        for (CanonicalRow row : rows) {
            ValidationResult result = validator.validate(row);
            assertThat(result.accepted() ^ result.reason() != null)
                .as("row %d", row.arrivalIndex())
                .isTrue();
        }
    }
}

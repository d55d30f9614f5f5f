package dev.pekelund.billing.validation;

import dev.pekelund.billing.rows.CanonicalRow;
import java.math.BigDecimal;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Decides whether a normalized row is billable. Rules are applied in a fixed order and the first
 * violated rule is reported.
 */
public class RowValidator {

    private final String placeholderCuCode;

    public RowValidator(String placeholderCuCode) {
        this.placeholderCuCode = Objects.requireNonNull(placeholderCuCode, "placeholderCuCode").trim();
    }

    public ValidationResult validate(CanonicalRow row) {
        if (!StringUtils.hasText(row.workRequest())) {
            return ValidationResult.reject(RejectReason.MISSING_WORK_REQUEST);
        }
        if (row.loggedDate() == null) {
            return ValidationResult.reject(RejectReason.MISSING_OR_INVALID_DATE);
        }
        if (!row.completed()) {
            return ValidationResult.reject(RejectReason.NOT_COMPLETED);
        }
        if (row.totalPrice() == null || row.totalPrice().compareTo(BigDecimal.ZERO) <= 0) {
            return ValidationResult.reject(RejectReason.NON_POSITIVE_PRICE);
        }
        if (!StringUtils.hasText(row.cuCode()) || row.cuCode().trim().equalsIgnoreCase(placeholderCuCode)) {
            return ValidationResult.reject(RejectReason.PLACEHOLDER_CU);
        }
        return ValidationResult.accept();
    }
}

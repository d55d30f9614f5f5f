package dev.pekelund.billing.validation;

/**
 * Reason a row was not billed, in the order the validator checks them.
 */
public enum RejectReason {
    MISSING_WORK_REQUEST,
    MISSING_OR_INVALID_DATE,
    NOT_COMPLETED,
    NON_POSITIVE_PRICE,
    PLACEHOLDER_CU
}

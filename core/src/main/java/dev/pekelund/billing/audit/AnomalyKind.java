package dev.pekelund.billing.audit;

public enum AnomalyKind {

    /**
     * A row priced far from the mean of its work request.
     */
    PRICE_VARIANCE,
    NEGATIVE_PRICE,
    ZERO_QUANTITY,
    MISSING_WORK_REQUEST
}

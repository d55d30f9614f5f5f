package dev.pekelund.billing.rows;

/**
 * Canonical column names of a billing row after synonym normalization.
 */
public final class BillingColumns {

    public static final String WORK_REQUEST = "Work Request #";

    /**
     * Preferred source of the logged date.
     */
    public static final String LOGGED_DATE = "Weekly Reference Logged Date";

    /**
     * Fallback source of the logged date when the weekly reference column is empty.
     */
    public static final String SNAPSHOT_DATE = "Snapshot Date";

    public static final String UNITS_COMPLETED = "Units Completed?";
    public static final String TOTAL_PRICE = "Units Total Price";
    public static final String QUANTITY = "Quantity";
    public static final String UNIT_OF_MEASURE = "Unit of Measure";
    public static final String CU = "CU";
    public static final String CU_DESCRIPTION = "CU Description";
    public static final String WORK_TYPE = "Work Type";
    public static final String POLE = "Pole #";
    public static final String FOREMAN = "Foreman";
    public static final String DEPARTMENT = "Dept #";
    public static final String SCOPE = "Scope #";
    public static final String HELPER_FOREMAN = "Foreman Helping?";
    public static final String HELPER_COMPLETED = "Helping Foreman Completed Unit?";
    public static final String HELPER_DEPARTMENT = "Helper Dept #";
    public static final String HELPER_JOB = "Helper Job #";

    private BillingColumns() {
    }
}

package dev.pekelund.billing.grouping;

/**
 * A helper row that could not be split out because a helper billing id was missing. The row is
 * billed in its primary packet instead.
 */
public record HelperFallbackWarning(
    long arrivalIndex,
    PacketKey primaryKey,
    String helperForeman,
    boolean missingDepartment,
    boolean missingJob
) {

    public String message() {
        StringBuilder missing = new StringBuilder();
        if (missingDepartment) {
            missing.append("Helper Dept #");
        }
        if (missingJob) {
            if (missing.length() > 0) {
                missing.append(" and ");
            }
            missing.append("Helper Job #");
        }
        return "Row %d for WR %s has helper '%s' but no %s; billed in the primary packet"
            .formatted(arrivalIndex, primaryKey.workRequest(), helperForeman, missing);
    }
}

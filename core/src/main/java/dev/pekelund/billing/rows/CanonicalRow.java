package dev.pekelund.billing.rows;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Fixed-shape billing row produced by {@link ColumnSynonymNormalizer}. Values that could not be
 * read from the source are {@code null}; {@link dev.pekelund.billing.validation.RowValidator}
 * decides whether the row is billable.
 */
public record CanonicalRow(
    long arrivalIndex,
    String workRequest,
    LocalDate loggedDate,
    LocalDate snapshotDate,
    boolean completed,
    BigDecimal totalPrice,
    BigDecimal quantity,
    String unitOfMeasure,
    String cuCode,
    String cuDescription,
    String workType,
    String poleId,
    String foreman,
    String department,
    String scope,
    String helperForeman,
    boolean helperCompleted,
    String helperDepartment,
    String helperJob,
    Map<String, String> descriptive
) {

    public CanonicalRow {
        descriptive = descriptive != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(descriptive))
            : Map.of();
    }

    /**
     * A row is a helper candidate when a helping foreman is named and the helper completion
     * checkbox is ticked.
     */
    public boolean isHelperCandidate() {
        return StringUtils.hasText(helperForeman) && helperCompleted;
    }

    /**
     * Helper candidates can only be split out when both helper billing identifiers are present.
     */
    public boolean hasHelperBillingIds() {
        return StringUtils.hasText(helperDepartment) && StringUtils.hasText(helperJob);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private long arrivalIndex;
        private String workRequest;
        private LocalDate loggedDate;
        private LocalDate snapshotDate;
        private boolean completed;
        private BigDecimal totalPrice;
        private BigDecimal quantity;
        private String unitOfMeasure;
        private String cuCode;
        private String cuDescription;
        private String workType;
        private String poleId;
        private String foreman;
        private String department;
        private String scope;
        private String helperForeman;
        private boolean helperCompleted;
        private String helperDepartment;
        private String helperJob;
        private final Map<String, String> descriptive = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder arrivalIndex(long arrivalIndex) {
            this.arrivalIndex = arrivalIndex;
            return this;
        }

        public Builder workRequest(String workRequest) {
            this.workRequest = workRequest;
            return this;
        }

        public Builder loggedDate(LocalDate loggedDate) {
            this.loggedDate = loggedDate;
            return this;
        }

        public Builder snapshotDate(LocalDate snapshotDate) {
            this.snapshotDate = snapshotDate;
            return this;
        }

        public Builder completed(boolean completed) {
            this.completed = completed;
            return this;
        }

        public Builder totalPrice(BigDecimal totalPrice) {
            this.totalPrice = totalPrice;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder unitOfMeasure(String unitOfMeasure) {
            this.unitOfMeasure = unitOfMeasure;
            return this;
        }

        public Builder cuCode(String cuCode) {
            this.cuCode = cuCode;
            return this;
        }

        public Builder cuDescription(String cuDescription) {
            this.cuDescription = cuDescription;
            return this;
        }

        public Builder workType(String workType) {
            this.workType = workType;
            return this;
        }

        public Builder poleId(String poleId) {
            this.poleId = poleId;
            return this;
        }

        public Builder foreman(String foreman) {
            this.foreman = foreman;
            return this;
        }

        public Builder department(String department) {
            this.department = department;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder helperForeman(String helperForeman) {
            this.helperForeman = helperForeman;
            return this;
        }

        public Builder helperCompleted(boolean helperCompleted) {
            this.helperCompleted = helperCompleted;
            return this;
        }

        public Builder helperDepartment(String helperDepartment) {
            this.helperDepartment = helperDepartment;
            return this;
        }

        public Builder helperJob(String helperJob) {
            this.helperJob = helperJob;
            return this;
        }

        public Builder descriptive(String column, String value) {
            this.descriptive.put(column, value);
            return this;
        }

        public CanonicalRow build() {
            return new CanonicalRow(arrivalIndex, workRequest, loggedDate, snapshotDate, completed, totalPrice,
                quantity, unitOfMeasure, cuCode, cuDescription, workType, poleId, foreman, department, scope,
                helperForeman, helperCompleted, helperDepartment, helperJob, descriptive);
        }
    }
}

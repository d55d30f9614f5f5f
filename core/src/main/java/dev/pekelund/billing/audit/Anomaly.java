package dev.pekelund.billing.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * One audit finding. {@code magnitude} is the deviation in percent for price variance and the
 * offending value for integrity findings; {@code mean} and {@code deviationPercent} are only set
 * for price variance.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Anomaly(
    AnomalyKind kind,
    String workRequest,
    long arrivalIndex,
    BigDecimal magnitude,
    BigDecimal price,
    BigDecimal mean,
    BigDecimal deviationPercent,
    String description
) {

    public Anomaly {
        Objects.requireNonNull(kind, "kind");
    }

    static Anomaly priceVariance(String workRequest, long arrivalIndex, BigDecimal price, BigDecimal mean,
        BigDecimal deviationPercent) {

        String description = "Price %s deviates %s%% from the WR# %s mean of %s"
            .formatted(price.toPlainString(), deviationPercent.toPlainString(), workRequest, mean.toPlainString());
        return new Anomaly(AnomalyKind.PRICE_VARIANCE, workRequest, arrivalIndex, deviationPercent, price, mean,
            deviationPercent, description);
    }

    static Anomaly integrity(AnomalyKind kind, String workRequest, long arrivalIndex, BigDecimal value,
        BigDecimal price, String description) {

        return new Anomaly(kind, workRequest, arrivalIndex, value, price, null, null, description);
    }
}

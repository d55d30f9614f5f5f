package dev.pekelund.billing.history;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * Last successful generation of one packet. The JSON property names follow the layout of the
 * {@code hash_history.json} file earlier runs wrote, so existing history keeps working.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryRecord(
    @JsonProperty("hash") String fingerprint,
    @JsonProperty("artifact") String artifactRef,
    @JsonProperty("updated_at") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant generatedAt,
    @JsonProperty("rows") int rowCount,
    @JsonProperty("foreman") String foreman,
    @JsonProperty("week") String weekCode
) {

    public HistoryRecord {
        Objects.requireNonNull(fingerprint, "fingerprint");
    }
}

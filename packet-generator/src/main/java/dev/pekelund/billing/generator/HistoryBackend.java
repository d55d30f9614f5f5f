package dev.pekelund.billing.generator;

import dev.pekelund.billing.config.InvalidConfigurationException;
import java.util.Locale;
import org.springframework.util.StringUtils;

public enum HistoryBackend {
    FILE,
    GCS;

    static HistoryBackend parse(String value) {
        if (!StringUtils.hasText(value)) {
            return FILE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidConfigurationException("HISTORY_BACKEND must be 'file' or 'gcs' but was '" + value + "'",
                ex);
        }
    }
}

package dev.pekelund.billing.fingerprint;

import java.util.regex.Pattern;

/**
 * Fixed-width digest of a packet's billable content.
 */
public record Fingerprint(String value) {

    public static final int LENGTH = 16;

    private static final Pattern HEX = Pattern.compile("^[0-9a-f]{" + LENGTH + "}$");

    public Fingerprint {
        if (value == null || !HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Fingerprint must be " + LENGTH + " lowercase hex characters: " + value);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}

package dev.pekelund.billing.fingerprint;

import dev.pekelund.billing.grouping.Packet;
import dev.pekelund.billing.rows.CanonicalRow;
import dev.pekelund.billing.rows.CellValues;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hashes the economically meaningful content of a packet. Only values that change what is billed
 * take part (work request, completion, CU, quantity, canonical price, logged date), so a price
 * typed as {@code "$1,250.00"} or {@code 1250.0} hashes the same. Rows are hashed in packet order.
 *
 * <p>With extended change detection the foreman, department and scope also count as changes.
 */
public class FingerprintEngine {

    private static final char FIELD_SEPARATOR = '\u001f';
    private static final char ROW_SEPARATOR = '\u001e';

    private final boolean extendedChangeDetection;

    public FingerprintEngine(boolean extendedChangeDetection) {
        this.extendedChangeDetection = extendedChangeDetection;
    }

    public Fingerprint fingerprint(Packet packet) {
        return new Fingerprint(sha256Hex(canonicalContent(packet)).substring(0, Fingerprint.LENGTH));
    }

    String canonicalContent(Packet packet) {
        StringBuilder content = new StringBuilder();
        for (CanonicalRow row : packet.rows()) {
            appendField(content, row.workRequest());
            appendField(content, Boolean.toString(row.completed()));
            appendField(content, row.cuCode());
            appendField(content, CellValues.canonicalQuantity(row.quantity()));
            appendField(content, CellValues.canonicalPrice(row.totalPrice()));
            appendField(content, row.loggedDate() != null ? row.loggedDate().toString() : null);
            if (extendedChangeDetection) {
                appendField(content, row.foreman());
                appendField(content, row.department());
                appendField(content, row.scope());
            }
            content.append(ROW_SEPARATOR);
        }
        return content.toString();
    }

    private static void appendField(StringBuilder content, String value) {
        content.append(value != null ? value.trim() : "").append(FIELD_SEPARATOR);
    }

    private static String sha256Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder(2 * hashBytes.length);
            for (byte b : hashBytes) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }
}

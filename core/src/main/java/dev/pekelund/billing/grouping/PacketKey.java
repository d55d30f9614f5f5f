package dev.pekelund.billing.grouping;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Identity of a billing packet: work request, week-ending date and, for helper packets, the
 * helping foreman.
 */
public record PacketKey(String workRequest, LocalDate weekEnding, String helperForeman) {

    private static final DateTimeFormatter WEEK_CODE = DateTimeFormatter.ofPattern("MMddyy", Locale.US);
    private static final String SEPARATOR = "|";
    private static final String HELPER_MARKER = "HELPER";

    public PacketKey {
        if (!StringUtils.hasText(workRequest)) {
            throw new IllegalArgumentException("workRequest must not be blank");
        }
        Objects.requireNonNull(weekEnding, "weekEnding");
        helperForeman = StringUtils.hasText(helperForeman) ? helperForeman.trim() : null;
    }

    public static PacketKey primary(String workRequest, LocalDate weekEnding) {
        return new PacketKey(workRequest, weekEnding, null);
    }

    public static PacketKey helper(String workRequest, LocalDate weekEnding, String helperForeman) {
        if (!StringUtils.hasText(helperForeman)) {
            throw new IllegalArgumentException("helperForeman must not be blank for a helper packet");
        }
        return new PacketKey(workRequest, weekEnding, helperForeman);
    }

    public boolean isHelper() {
        return helperForeman != null;
    }

    /**
     * Week ending as {@code MMddyy}, the code used in artifact names and history keys.
     */
    public String weekCode() {
        return WEEK_CODE.format(weekEnding);
    }

    /**
     * Stable textual id used as the history store key: {@code WR|MMddyy} for primary packets and
     * {@code WR|MMddyy|HELPER|name} for helper packets.
     */
    public String id() {
        String base = workRequest + SEPARATOR + weekCode();
        return isHelper() ? base + SEPARATOR + HELPER_MARKER + SEPARATOR + helperForeman : base;
    }

    @Override
    public String toString() {
        return id();
    }
}

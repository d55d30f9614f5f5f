package dev.pekelund.billing.rows;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Lenient conversions from spreadsheet cell values to typed values. Every method returns
 * {@code null} instead of throwing when a value cannot be interpreted.
 */
public final class CellValues {

    public static final int PRICE_SCALE = 2;

    // Cells beyond these bounds are data-entry garbage, not amounts.
    static final int MAX_INTEGER_DIGITS = 15;
    static final int MAX_FRACTION_DIGITS = 10;

    // Day zero of spreadsheet serial dates (accounts for the 1900 leap-year quirk).
    private static final LocalDate SERIAL_EPOCH = LocalDate.of(1899, 12, 30);
    private static final long MAX_SERIAL_DAY = 2_958_465L;

    private static final Pattern WHOLE_NUMBER_WITH_ZERO_FRACTION = Pattern.compile("^(-?\\d+)\\.0+$");
    private static final Pattern SERIAL_DAY = Pattern.compile("^\\d{1,7}(\\.\\d+)?$");
    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "y", "1", "checked", "x");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US),
        DateTimeFormatter.ofPattern("M/d/yy", Locale.US));

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ISO_OFFSET_DATE_TIME);

    private CellValues() {
    }

    public static String text(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            BigDecimal decimal = BigDecimal.valueOf(((Number) value).doubleValue());
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal decimal) {
            return inRange(decimal) ? decimal.toPlainString() : decimal.toString();
        }
        String text = value.toString().trim();
        return StringUtils.hasText(text) ? text : null;
    }

    /**
     * Work request numbers frequently arrive as floats ({@code 12345678.0}); they are rendered
     * without the zero fraction so the same request always produces the same identifier.
     */
    public static String workRequestId(Object value) {
        String text = text(value);
        if (text == null) {
            return null;
        }
        var matcher = WHOLE_NUMBER_WITH_ZERO_FRACTION.matcher(text);
        return matcher.matches() ? matcher.group(1) : text;
    }

    public static BigDecimal decimal(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return bounded(decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return null;
            }
            return bounded(BigDecimal.valueOf(number));
        }
        if (value instanceof Number number) {
            return bounded(new BigDecimal(number.toString()));
        }

        String text = value.toString().trim();
        boolean negative = false;
        if (text.startsWith("(") && text.endsWith(")")) {
            negative = true;
            text = text.substring(1, text.length() - 1);
        }
        text = text.replace("$", "").replace(",", "").replaceAll("\\s+", "");
        if (!StringUtils.hasText(text)) {
            return null;
        }
        try {
            BigDecimal parsed = bounded(new BigDecimal(text));
            return parsed != null && negative ? parsed.negate() : parsed;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Parses a currency value into its canonical fixed-precision form, so {@code "$1,250.00"},
     * {@code "1250"} and {@code 1250.0} all become {@code 1250.00}.
     */
    public static BigDecimal price(Object value) {
        BigDecimal decimal = decimal(value);
        return decimal != null ? decimal.setScale(PRICE_SCALE, RoundingMode.HALF_UP) : null;
    }

    public static String canonicalPrice(BigDecimal price) {
        return price != null ? price.setScale(PRICE_SCALE, RoundingMode.HALF_UP).toPlainString() : "";
    }

    public static String canonicalQuantity(BigDecimal quantity) {
        if (quantity == null) {
            return "";
        }
        if (quantity.signum() == 0) {
            return "0";
        }
        return quantity.stripTrailingZeros().toPlainString();
    }

    private static BigDecimal bounded(BigDecimal decimal) {
        if (decimal.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return inRange(decimal) ? decimal : null;
    }

    /**
     * True when the value has at most {@value #MAX_INTEGER_DIGITS} integer digits and at most
     * {@value #MAX_FRACTION_DIGITS} significant fraction digits, so scaling it or printing it in
     * plain notation stays cheap.
     */
    private static boolean inRange(BigDecimal decimal) {
        if (decimal.signum() == 0) {
            return decimal.scale() >= -MAX_INTEGER_DIGITS && decimal.scale() <= MAX_FRACTION_DIGITS;
        }
        long integerDigits = (long) decimal.precision() - decimal.scale();
        if (integerDigits > MAX_INTEGER_DIGITS) {
            return false;
        }
        // Trailing zeros in the fraction carry no magnitude.
        return decimal.scale() <= MAX_FRACTION_DIGITS
            || decimal.stripTrailingZeros().scale() <= MAX_FRACTION_DIGITS;
    }

    public static LocalDate date(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof Number number) {
            return fromSerialDay(number.doubleValue());
        }

        String text = value.toString().trim();
        if (!StringUtils.hasText(text)) {
            return null;
        }
        if (SERIAL_DAY.matcher(text).matches()) {
            return fromSerialDay(Double.parseDouble(text));
        }
        if (text.length() > 10 && text.charAt(4) == '-' && text.charAt(7) == '-') {
            LocalDate withTime = firstParsed(text, DATE_TIME_FORMATS);
            return withTime != null ? withTime : tryParse(text.substring(0, 10), DateTimeFormatter.ISO_LOCAL_DATE);
        }
        return firstParsed(text, DATE_FORMATS);
    }

    public static boolean flag(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0d;
        }
        return TRUE_VALUES.contains(value.toString().trim().toLowerCase(Locale.ROOT));
    }

    private static LocalDate firstParsed(String text, List<DateTimeFormatter> formats) {
        for (DateTimeFormatter format : formats) {
            LocalDate parsed = tryParse(text, format);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static LocalDate tryParse(String text, DateTimeFormatter format) {
        try {
            return format.parse(text, LocalDate::from);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static LocalDate fromSerialDay(double serial) {
        long day = (long) Math.floor(serial);
        if (day < 1 || day > MAX_SERIAL_DAY) {
            return null;
        }
        return SERIAL_EPOCH.plusDays(day);
    }
}

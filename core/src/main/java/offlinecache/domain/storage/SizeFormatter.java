package offlinecache.domain.storage;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Renders byte counts with base-1024 units and at most one decimal place.
 */
public final class SizeFormatter {
    private static final String[] UNITS = {"Bytes", "KB", "MB", "GB"};
    private static final BigDecimal BASE = BigDecimal.valueOf(1024);

    private SizeFormatter() {
    }

    public static String format(final long bytes) {
        checkArgument(bytes >= 0, "bytes must not be negative");

        if (bytes == 0) {
            return "0 Bytes";
        }

        int unit = 0;
        BigDecimal value = BigDecimal.valueOf(bytes);
        while (value.compareTo(BASE) >= 0 && unit < UNITS.length - 1) {
            value = value.divide(BASE);
            unit++;
        }

        final BigDecimal rounded = value.setScale(1, RoundingMode.HALF_UP).stripTrailingZeros();
        return rounded.toPlainString() + " " + UNITS[unit];
    }
}

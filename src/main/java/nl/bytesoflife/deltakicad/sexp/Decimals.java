package nl.bytesoflife.deltakicad.sexp;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The single rounding and formatting rule for numbers written to a document and
 * for coordinates used as connectivity keys: 4 decimals, half up, plain notation,
 * trailing zeros stripped.
 */
public final class Decimals {

    public static final int SCALE = 4;

    /** Largest magnitude whose fixed-point form fits a {@code long}. */
    public static final double LIMIT = 9e14;

    private Decimals() {
    }

    /**
     * {@code value} in units of 10^-{@value #SCALE}.
     */
    public static long toFixed(double value) {
        if (!isRepresentable(value)) {
            throw new IllegalArgumentException("Not a finite number within +/-" + LIMIT + ": " + value);
        }
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).unscaledValue().longValueExact();
    }

    public static boolean isRepresentable(double value) {
        return !Double.isNaN(value) && Math.abs(value) <= LIMIT;
    }

    public static String formatFixed(long fixed) {
        return BigDecimal.valueOf(fixed, SCALE).stripTrailingZeros().toPlainString();
    }

    public static String format(double value) {
        return formatFixed(toFixed(value));
    }
}

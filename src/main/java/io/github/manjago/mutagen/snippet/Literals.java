package io.github.manjago.mutagen.snippet;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rendering of numeric literals back into source text.
 */
public final class Literals {

    /**
     * Decimal places kept when rendering floating-point literals.
     */
    public static final int FLOAT_PRECISION = 6;

    private Literals() {}

    /**
     * Render a number as a literal.
     * Integers print without a decimal point; floats keep at most six
     * decimals, drop trailing zeros, and always keep one digit after the point.
     */
    public static String formatNumber(double value, boolean integer) {
        if (integer) {
            return Long.toString(Math.round(value));
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot render non-finite literal: " + value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value)
            .setScale(FLOAT_PRECISION, RoundingMode.HALF_UP)
            .stripTrailingZeros();
        String text = rounded.toPlainString();
        if (text.equals("-0")) {
            text = "0";
        }
        return text.contains(".") ? text : text + ".0";
    }

    /**
     * Round to the precision {@link #formatNumber} renders with, so that
     * the value written equals the value reported.
     */
    public static double roundToPrecision(double value) {
        return BigDecimal.valueOf(value).setScale(FLOAT_PRECISION, RoundingMode.HALF_UP).doubleValue();
    }
}

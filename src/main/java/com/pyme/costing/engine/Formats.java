package com.pyme.costing.engine;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Number formatting for user-facing strings. Amounts use Colombian grouping ("$1.250.000").
 */
final class Formats {

    private static final Locale ES_CO = new Locale("es", "CO");

    private Formats() {
    }

    /** Whole pesos with thousands separators. */
    static String cop(double amount) {
        DecimalFormat format = new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(ES_CO));
        return "$" + format.format(Math.round(amount));
    }

    /** Rounded percentage, e.g. 0.543 -> "54%". */
    static String percent(double fraction) {
        return Math.round(fraction * 100) + "%";
    }

    /** One decimal, dot separated, e.g. 54.3. */
    static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    /** Drops a trailing ".0" from whole numbers. */
    static String plain(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}

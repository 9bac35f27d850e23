package com.repo.treemap.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * Text shown for treemap nodes: grouped values, two-decimal percentages of the dataset
 * total and " > " joined paths.
 */
public final class LabelFormatter {

    public static final String ROOT_LABEL = "Root";
    public static final String PATH_SEPARATOR = " > ";

    private LabelFormatter() {
    }

    /**
     * Value with a comma thousands separator and no decimals, e.g. {@code 12,345}.
     * Ties round to even on the exact binary value.
     */
    public static String formatValue(double value) {
        if (!Double.isFinite(value))
            return String.valueOf(value);
        BigDecimal rounded = new BigDecimal(value).setScale(0, RoundingMode.HALF_EVEN);
        return String.format(Locale.US, "%,d", rounded.toBigInteger());
    }

    /**
     * Share of the total in percent, rounded half-even to two decimals on the exact binary
     * quotient. A zero total yields 0.
     */
    public static double percentage(double value, double total) {
        if (total == 0 || !Double.isFinite(total) || !Double.isFinite(value))
            return 0.0;
        return new BigDecimal(value * 100.0 / total)
                .setScale(2, RoundingMode.HALF_EVEN)
                .doubleValue();
    }

    public static String formatPercentage(double value, double total) {
        return String.format(Locale.US, "%.2f%%", percentage(value, total));
    }

    /**
     * Node text, e.g. {@code Billing (1,250, 12.50%)}.
     */
    public static String displayLabel(String name, double value, double total) {
        return name + " (" + formatValue(value) + ", " + formatPercentage(value, total) + ")";
    }

    /**
     * Machine-readable number without grouping or trailing zeros, e.g. {@code 1250} or {@code 2.5}.
     */
    public static String plainNumber(double value) {
        if (!Double.isFinite(value))
            return String.valueOf(value);
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String pathString(List<String> path) {
        return path.isEmpty() ? ROOT_LABEL : String.join(PATH_SEPARATOR, path);
    }

    public static String hoverText(List<String> path, String valueColumn, double value, double total) {
        return "<b>" + pathString(path) + "</b><br>" + valueColumn + ": " + formatValue(value)
                + "<br>Percentage of Total: " + formatPercentage(value, total);
    }
}

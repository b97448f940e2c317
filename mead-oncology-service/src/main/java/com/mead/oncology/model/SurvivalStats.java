package com.mead.oncology.model;

/**
 * Published survival figure for a guideline entry, e.g. "5-year survival" 85-93 %.
 * Display only; never consulted by the matcher.
 */
public record SurvivalStats(
        String measure,
        double low,
        double high,
        String unit
) {

    public String display() {
        String range = format(low) + "-" + format(high);
        return "%".equals(unit)
                ? range + "% " + measure
                : measure + " " + range + " " + unit;
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}

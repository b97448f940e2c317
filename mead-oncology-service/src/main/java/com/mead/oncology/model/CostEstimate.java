package com.mead.oncology.model;

/**
 * Cost range of one treatment in both currencies the guideline tables quote.
 *
 * @param period {@link #ONE_TIME} or {@link #PER_YEAR}
 */
public record CostEstimate(
        MoneyRange inr,
        MoneyRange usd,
        String period
) {

    public static final String ONE_TIME = "one-time";
    public static final String PER_YEAR = "per-year";
}

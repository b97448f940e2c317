package com.mead.oncology.model;

public record MoneyRange(
        String currency,
        long min,
        long max
) {

    public static final String INR = "INR";
    public static final String USD = "USD";
}

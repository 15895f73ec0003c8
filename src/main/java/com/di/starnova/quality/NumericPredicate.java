package com.di.starnova.quality;

import java.io.Serializable;
import java.util.Locale;

/**
 * Closed or half-open numeric interval a column's values must fall into.
 */
public final class NumericPredicate implements Serializable {

    private final double min;
    private final double max;
    private final String description;

    private NumericPredicate(double min, double max, String description) {
        this.min = min;
        this.max = max;
        this.description = description;
    }

    public static NumericPredicate nonNegative() {
        return new NumericPredicate(0.0, Double.POSITIVE_INFINITY, ">= 0");
    }

    static NumericPredicate between(double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " > max " + max);
        }
        return new NumericPredicate(min, max, String.format(Locale.ROOT, "between %s and %s", min, max));
    }

    public boolean test(double value) {
        return value >= min && value <= max;
    }

    public String describe() {
        return description;
    }

    @Override
    public String toString() {
        return description;
    }
}

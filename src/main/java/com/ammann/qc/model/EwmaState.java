/* (C)2026 */
package com.ammann.qc.model;

/**
 * Running EWMA value after {@code count} points. The first point seeds the average.
 *
 * @param value current weighted average (meaningless while {@code count == 0})
 * @param count number of points folded in so far
 */
public record EwmaState(double value, int count) {

    private static final EwmaState INITIAL = new EwmaState(Double.NaN, 0);

    /** State before the first point. */
    public static EwmaState initial() {
        return INITIAL;
    }

    public boolean isSeeded() {
        return count > 0;
    }
}

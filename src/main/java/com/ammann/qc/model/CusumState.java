/* (C)2026 */
package com.ammann.qc.model;

/**
 * Running CUSUM accumulators after {@code count} points.
 *
 * @param positive upper (upward shift) sum, never negative
 * @param negative lower (downward shift) sum, never negative
 * @param count    number of points folded in so far
 */
public record CusumState(double positive, double negative, int count) {

    private static final CusumState INITIAL = new CusumState(0.0, 0.0, 0);

    /** State before the first point. */
    public static CusumState initial() {
        return INITIAL;
    }
}

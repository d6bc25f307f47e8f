/* (C)2026 */
package com.ammann.qc.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable state retained between incremental evaluations.
 *
 * @param trailing   most recent values, oldest first, at most {@code capacity} entries
 * @param capacity   maximum length of the trailing buffer
 * @param nextIndex  series index the next point will receive
 * @param cusum      CUSUM accumulators
 * @param ewma       EWMA accumulator
 */
public record StreamingState(
        List<Double> trailing, int capacity, int nextIndex, CusumState cusum, EwmaState ewma) {

    public StreamingState {
        if (capacity < 2) {
            throw new IllegalArgumentException("Trailing buffer capacity must be at least 2");
        }
        trailing = List.copyOf(trailing);
    }

    /**
     * Empty state for a fresh stream.
     *
     * @param capacity trailing buffer size
     */
    public static StreamingState initial(int capacity) {
        return new StreamingState(List.of(), capacity, 0, CusumState.initial(), EwmaState.initial());
    }

    /**
     * Returns the state after appending a value, evicting the oldest entry when full.
     */
    public StreamingState append(double value, CusumState nextCusum, EwmaState nextEwma) {
        List<Double> buffer = new ArrayList<>(trailing.size() + 1);
        int dropFrom = trailing.size() >= capacity ? trailing.size() - capacity + 1 : 0;
        buffer.addAll(trailing.subList(dropFrom, trailing.size()));
        buffer.add(value);
        return new StreamingState(buffer, capacity, nextIndex + 1, nextCusum, nextEwma);
    }

    /** Trailing values as a primitive array, oldest first. */
    public double[] trailingValues() {
        return trailing.stream().mapToDouble(Double::doubleValue).toArray();
    }
}

/* (C)2026 */
package com.ammann.qc.model;

import java.util.List;

/**
 * Output of an EWMA pass: the violations, the smoothed series and its fixed control limits.
 *
 * @param violations EWMA_HIGH / EWMA_LOW findings in index order
 * @param ewma       weighted average per index; index 0 holds the seed
 * @param upperLimit upper control limit
 * @param lowerLimit lower control limit
 */
public record EwmaResult(
        List<Violation> violations, List<Double> ewma, double upperLimit, double lowerLimit) {

    public EwmaResult {
        violations = List.copyOf(violations);
        ewma = List.copyOf(ewma);
    }
}

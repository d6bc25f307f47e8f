/* (C)2026 */
package com.ammann.qc.model;

import java.util.List;

/**
 * Output of a CUSUM pass: the violations plus both accumulator series for charting.
 *
 * @param violations CUSUM_HIGH / CUSUM_LOW findings in index order
 * @param positive   upper sum per index
 * @param negative   lower sum per index
 */
public record CusumResult(List<Violation> violations, List<Double> positive, List<Double> negative) {

    public CusumResult {
        violations = List.copyOf(violations);
        positive = List.copyOf(positive);
        negative = List.copyOf(negative);
    }
}

/* (C)2026 */
package com.ammann.qc.model;

import java.util.List;

/**
 * Everything a comparison of two measurement methods produces.
 *
 * @param count        number of paired samples
 * @param significance significance level the tests were judged against
 * @param blandAltman  agreement statistics
 * @param correlation  correlation and regression
 * @param tests        paired t, independent t and Mann-Whitney U, followed by the ANOVA
 *                     when groups were given
 */
public record MethodComparisonResult(
        int count,
        double significance,
        BlandAltmanResult blandAltman,
        CorrelationResult correlation,
        List<HypothesisTestResult> tests) {

    public MethodComparisonResult {
        tests = List.copyOf(tests);
    }
}

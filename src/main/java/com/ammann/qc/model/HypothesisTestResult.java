/* (C)2026 */
package com.ammann.qc.model;

import com.ammann.qc.enumeration.StatisticalTest;
import java.util.Objects;

/**
 * Outcome of one significance test.
 *
 * @param test        the test that was run
 * @param statistic   test statistic (t, U or F)
 * @param pValue      two-sided p-value
 * @param significant whether {@code pValue} is below the significance level
 */
public record HypothesisTestResult(
        StatisticalTest test, double statistic, double pValue, boolean significant) {

    public HypothesisTestResult {
        Objects.requireNonNull(test, "test");
    }

    /**
     * @param test      the test that was run
     * @param statistic test statistic
     * @param pValue    p-value, NaN when the statistic is undefined
     * @param alpha     significance level
     */
    public static HypothesisTestResult of(
            StatisticalTest test, double statistic, double pValue, double alpha) {
        return new HypothesisTestResult(test, statistic, pValue, pValue < alpha);
    }
}

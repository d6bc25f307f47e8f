/* (C)2026 */
package com.ammann.qc.enumeration;

/**
 * Significance tests run when two measurement methods are compared.
 */
public enum StatisticalTest {
    /** Paired Student t-test on the same samples measured by both methods. */
    PAIRED_T("Paired t-test"),
    /** Two-sample t-test assuming equal variances. */
    INDEPENDENT_T("Independent t-test"),
    /** Non-parametric alternative to the independent t-test. */
    MANN_WHITNEY_U("Mann-Whitney U"),
    /** One-way analysis of variance across three or more groups. */
    ONE_WAY_ANOVA("One-way ANOVA");

    private final String label;

    StatisticalTest(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

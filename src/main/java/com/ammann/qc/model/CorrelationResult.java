/* (C)2026 */
package com.ammann.qc.model;

/**
 * Correlation and least-squares fit of method B against method A.
 *
 * @param pearsonR    Pearson product-moment correlation
 * @param pearsonP    two-sided p-value of the Pearson correlation
 * @param spearmanR   Spearman rank correlation
 * @param spearmanP   two-sided p-value of the Spearman correlation
 * @param slope       slope of {@code b = slope * a + intercept}
 * @param intercept   intercept of the fit
 * @param rSquared    coefficient of determination of the fit
 */
public record CorrelationResult(
        double pearsonR,
        double pearsonP,
        double spearmanR,
        double spearmanP,
        double slope,
        double intercept,
        double rSquared) {}

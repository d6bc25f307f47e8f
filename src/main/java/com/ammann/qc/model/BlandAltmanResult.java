/* (C)2026 */
package com.ammann.qc.model;

/**
 * Agreement between two methods measuring the same samples.
 *
 * @param count                   number of paired samples
 * @param meanDifference          mean of {@code a - b}
 * @param sdDifference            sample standard deviation of the differences
 * @param upperLimit              upper limit of agreement, mean + 1.96 SD
 * @param lowerLimit              lower limit of agreement, mean - 1.96 SD
 * @param limitConfidenceHalfWidth half-width of the 95% confidence interval of either limit
 * @param withinLimitsPercent     share of differences inside the limits, in percent
 */
public record BlandAltmanResult(
        int count,
        double meanDifference,
        double sdDifference,
        double upperLimit,
        double lowerLimit,
        double limitConfidenceHalfWidth,
        double withinLimitsPercent) {}

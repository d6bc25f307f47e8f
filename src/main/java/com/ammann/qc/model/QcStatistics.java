/* (C)2026 */
package com.ammann.qc.model;

import com.ammann.qc.enumeration.SigmaQuality;

/**
 * Descriptive statistics of a series relative to its target process.
 *
 * @param count             number of values
 * @param mean              observed mean
 * @param standardDeviation sample standard deviation (n - 1)
 * @param biasPercent       deviation of the observed mean from the target mean, in percent
 * @param cvPercent         coefficient of variation in percent
 * @param sigma             sigma metric {@code (TEa% - |bias%|) / CV%}
 * @param sigmaQuality      capability class of the sigma metric, {@code null} without TEa
 */
public record QcStatistics(
        int count,
        double mean,
        double standardDeviation,
        double biasPercent,
        double cvPercent,
        double sigma,
        SigmaQuality sigmaQuality) {

    /**
     * Statistics object for a series too short to describe.
     *
     * @param count number of values available
     */
    public static QcStatistics empty(int count) {
        return new QcStatistics(count, 0.0, 0.0, 0.0, 0.0, 0.0, null);
    }
}

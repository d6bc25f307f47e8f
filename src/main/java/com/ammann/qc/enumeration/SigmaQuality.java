/* (C)2026 */
package com.ammann.qc.enumeration;

/**
 * Process capability class derived from the sigma metric.
 *
 * <p>A sigma value is classified into the highest level whose threshold it meets or exceeds.
 */
public enum SigmaQuality {
    /** Sigma of 6 or above. */
    WORLD_CLASS(6.0, "World Class (Six Sigma)"),
    /** Sigma of 5 or above. */
    EXCELLENT(5.0, "Excellent"),
    /** Sigma of 4 or above. */
    GOOD(4.0, "Good"),
    /** Sigma of 3 or above. */
    MARGINAL(3.0, "Marginal"),
    /** Sigma below 3. */
    POOR(Double.NEGATIVE_INFINITY, "Poor");

    private final double threshold;
    private final String label;

    SigmaQuality(double threshold, String label) {
        this.threshold = threshold;
        this.label = label;
    }

    /**
     * Returns the quality class corresponding to the given sigma metric.
     *
     * @param sigma sigma metric
     * @return the highest class whose threshold the sigma meets
     */
    public static SigmaQuality fromSigma(double sigma) {
        if (sigma >= WORLD_CLASS.threshold) return WORLD_CLASS;
        if (sigma >= EXCELLENT.threshold) return EXCELLENT;
        if (sigma >= GOOD.threshold) return GOOD;
        if (sigma >= MARGINAL.threshold) return MARGINAL;
        return POOR;
    }

    public String getLabel() {
        return label;
    }
}

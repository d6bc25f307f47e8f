/* (C)2026 */
package com.ammann.qc.enumeration;

/**
 * Detector family that produced a violation.
 *
 * <p>Declaration order is the order in which the batch analysis runs the detectors and
 * therefore the tie-break order for violations that share an index.
 */
public enum DetectionMethod {
    WESTGARD("Westgard"),
    CUSUM("CUSUM"),
    EWMA("EWMA"),
    ANOMALY("Anomaly"),
    TREND("Trend"),
    RUN("Run");

    private final String label;

    DetectionMethod(String label) {
        this.label = label;
    }

    /** Human-readable method name used in reports. */
    public String getLabel() {
        return label;
    }
}

/* (C)2026 */
package com.ammann.qc.enumeration;

/**
 * Disposition recommended for the analytical run in which a violation occurred.
 */
public enum RecommendedAction {
    /** Run can be accepted. */
    ACCEPT,
    /** Run is accepted with a warning and should be investigated. */
    WARN,
    /** Run must be rejected. */
    REJECT;

    /**
     * Maps a violation severity to its default recommendation.
     *
     * @param severity severity of the finding
     * @return {@link #REJECT} for critical findings, {@link #WARN} otherwise
     */
    public static RecommendedAction forSeverity(Severity severity) {
        return severity == Severity.CRITICAL ? REJECT : WARN;
    }
}

/* (C)2026 */
package com.ammann.qc.enumeration;

/**
 * Overall verdict of an analysis, derived from the worst severity present.
 *
 * <p>The three states are mutually exclusive and exhaustive.
 */
public enum Disposition {
    /** No violations at all. */
    IN_CONTROL,
    /** Only WARNING violations. */
    NEEDS_REVIEW,
    /** At least one CRITICAL violation. */
    REJECT;

    /**
     * Derives the disposition from severity counts.
     *
     * @param critical number of critical violations
     * @param warning  number of warning violations
     * @return the matching disposition
     */
    public static Disposition fromCounts(long critical, long warning) {
        if (critical > 0) return REJECT;
        if (warning > 0) return NEEDS_REVIEW;
        return IN_CONTROL;
    }
}

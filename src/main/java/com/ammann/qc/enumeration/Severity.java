/* (C)2026 */
package com.ammann.qc.enumeration;

/**
 * Severity assigned to a rule violation.
 *
 * <p>CRITICAL findings force the run to be rejected, WARNING findings only flag it for review.
 */
public enum Severity {
    /** Out-of-control indication that needs investigation. */
    WARNING(1),
    /** Out-of-control condition that rejects the run. */
    CRITICAL(2);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    /**
     * Returns the more severe of this and the given severity.
     *
     * @param other severity to compare with (may be {@code null})
     * @return the worse of both severities
     */
    public Severity worst(Severity other) {
        if (other == null) {
            return this;
        }
        return other.rank > rank ? other : this;
    }

    public int getRank() {
        return rank;
    }
}

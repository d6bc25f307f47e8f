/* (C)2026 */
package com.ammann.qc.enumeration;

/**
 * Lifecycle of one analysis run.
 * <p>
 * Expected transition sequence is PENDING to EVALUATING to MERGED and then to exactly one of
 * IN_CONTROL, NEEDS_REVIEW or REJECT.
 */
public enum AnalysisStatus {
    /** Run created, no detector started */
    PENDING,
    /** Detectors are running */
    EVALUATING,
    /** Detector outputs merged, verdict not yet assigned */
    MERGED,
    /** No violations */
    IN_CONTROL,
    /** Warnings only */
    NEEDS_REVIEW,
    /** At least one critical violation */
    REJECT;

    /**
     * @return whether this status ends the run
     */
    public boolean isTerminal() {
        return this == IN_CONTROL || this == NEEDS_REVIEW || this == REJECT;
    }

    /**
     * Moves to the given status.
     *
     * @param next requested status
     * @return {@code next}
     * @throws IllegalStateException if the transition is not allowed
     */
    public AnalysisStatus advanceTo(AnalysisStatus next) {
        boolean allowed =
                switch (this) {
                    case PENDING -> next == EVALUATING;
                    case EVALUATING -> next == MERGED;
                    case MERGED -> next.isTerminal();
                    default -> false;
                };
        if (!allowed) {
            throw new IllegalStateException(
                    "Illegal analysis status transition " + this + " -> " + next);
        }
        return next;
    }

    /**
     * Terminal status matching a disposition.
     *
     * @param disposition verdict of the merged report
     * @return the terminal status
     */
    public static AnalysisStatus terminalFor(Disposition disposition) {
        return switch (disposition) {
            case IN_CONTROL -> IN_CONTROL;
            case NEEDS_REVIEW -> NEEDS_REVIEW;
            case REJECT -> REJECT;
        };
    }
}

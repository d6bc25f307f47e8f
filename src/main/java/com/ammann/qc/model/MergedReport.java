/* (C)2026 */
package com.ammann.qc.model;

import com.ammann.qc.enumeration.Disposition;
import java.util.List;

/**
 * Chronologically ordered violations of all detectors plus their summary.
 *
 * @param violations violations sorted by index; ties keep detector emission order
 * @param summary    counts and verdict
 */
public record MergedReport(List<Violation> violations, Summary summary) {

    public MergedReport {
        violations = List.copyOf(violations);
    }

    public Disposition disposition() {
        return summary.disposition();
    }

    /**
     * @param index series position
     * @return violations reported at the given index
     */
    public List<Violation> violationsAt(int index) {
        return violations.stream().filter(v -> v.index() == index).toList();
    }
}

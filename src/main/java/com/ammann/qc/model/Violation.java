/* (C)2026 */
package com.ammann.qc.model;

import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.RecommendedAction;
import com.ammann.qc.enumeration.Severity;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single out-of-control finding.
 *
 * @param index       position of the triggering point in the series
 * @param source      rule id or finding type, e.g. {@code 1-3s}, {@code CUSUM_HIGH}
 * @param method      detector family that produced the finding
 * @param severity    WARNING or CRITICAL
 * @param description human-readable explanation
 * @param action      recommended disposition of the run
 * @param evidence    detector-specific numbers backing the finding, in insertion order
 */
public record Violation(
        int index,
        String source,
        DetectionMethod method,
        Severity severity,
        String description,
        RecommendedAction action,
        Map<String, Double> evidence) {

    public static final String Z_SCORE = "zScore";

    public Violation {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(action, "action");
        evidence =
                evidence == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    /**
     * Creates a violation whose action follows its severity.
     */
    public static Violation of(
            int index,
            String source,
            DetectionMethod method,
            Severity severity,
            String description,
            Map<String, Double> evidence) {
        return new Violation(
                index,
                source,
                method,
                severity,
                description,
                RecommendedAction.forSeverity(severity),
                evidence);
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}

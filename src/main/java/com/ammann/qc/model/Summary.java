/* (C)2026 */
package com.ammann.qc.model;

import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.Disposition;
import com.ammann.qc.enumeration.Severity;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts and verdict of a merged report.
 *
 * @param totalViolations number of violations
 * @param critical        number of CRITICAL violations
 * @param warning         number of WARNING violations
 * @param byMethod        violation count per detector family (only families that fired)
 * @param bySeverity      violation count per severity (only severities present)
 * @param disposition     overall verdict
 * @param message         one-line textual summary
 */
public record Summary(
        int totalViolations,
        int critical,
        int warning,
        Map<DetectionMethod, Integer> byMethod,
        Map<Severity, Integer> bySeverity,
        Disposition disposition,
        String message) {

    public Summary {
        byMethod =
                byMethod.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new EnumMap<>(byMethod));
        bySeverity =
                bySeverity.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new EnumMap<>(bySeverity));
    }
}

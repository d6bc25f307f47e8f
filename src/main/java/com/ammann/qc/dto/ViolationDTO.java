/* (C)2026 */
package com.ammann.qc.dto;

import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.RecommendedAction;
import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.model.Violation;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Single out-of-control finding at one series position")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ViolationDTO(
        @Schema(description = "Zero-based position in the series", example = "10")
        Integer index,

        @Schema(description = "Rule or detector code", example = "1-3s")
        String source,

        @Schema(description = "Detector family")
        DetectionMethod method,

        @Schema(description = "Severity of the finding")
        Severity severity,

        @Schema(description = "Human-readable description")
        String description,

        @Schema(description = "Recommended action for the run")
        RecommendedAction action,

        @Schema(description = "Detector-specific numeric evidence, e.g. zScore or cusum")
        Map<String, Double> evidence
) {
    public static ViolationDTO from(Violation violation) {
        return new ViolationDTO(
                violation.index(),
                violation.source(),
                violation.method(),
                violation.severity(),
                violation.description(),
                violation.action(),
                violation.evidence().isEmpty() ? null : violation.evidence());
    }
}

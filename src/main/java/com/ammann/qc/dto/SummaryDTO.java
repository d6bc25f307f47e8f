/* (C)2026 */
package com.ammann.qc.dto;

import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.Disposition;
import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.model.Summary;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Violation counts and overall verdict")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SummaryDTO(
        @Schema(description = "Total number of violations")
        Integer totalViolations,

        @Schema(description = "Number of critical violations")
        Integer critical,

        @Schema(description = "Number of warnings")
        Integer warning,

        @Schema(description = "Violations per detector family")
        Map<DetectionMethod, Integer> byMethod,

        @Schema(description = "Violations per severity")
        Map<Severity, Integer> bySeverity,

        @Schema(description = "Overall verdict")
        Disposition disposition,

        @Schema(description = "One-line summary", example = "No violations detected - QC is in control")
        String message
) {
    public static SummaryDTO from(Summary summary) {
        return new SummaryDTO(
                summary.totalViolations(),
                summary.critical(),
                summary.warning(),
                summary.byMethod(),
                summary.bySeverity(),
                summary.disposition(),
                summary.message());
    }
}

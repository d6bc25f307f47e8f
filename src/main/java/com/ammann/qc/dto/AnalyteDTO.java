/* (C)2026 */
package com.ammann.qc.dto;

import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.ThresholdMultipliers;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Configured analyte and its process parameters")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyteDTO(
        @Schema(description = "Analyte name", example = "creatinine")
        String name,

        @Schema(description = "Measurement unit", example = "mg/dL")
        String unit,

        @Schema(description = "Target mean", example = "1.0")
        Double mean,

        @Schema(description = "Process standard deviation", example = "0.05")
        Double std,

        @Schema(description = "Sensitivity tier", example = "MEDIUM")
        String sensitivity,

        @Schema(description = "Warning, alert and critical multipliers of the tier")
        ThresholdMultipliers thresholds,

        @Schema(description = "Total allowable error in percent", example = "15")
        Double teaPercent
) {
    public static AnalyteDTO from(String name, String unit, ProcessParameters params) {
        return new AnalyteDTO(
                name,
                unit,
                params.getMean(),
                params.getStd(),
                params.getSensitivity().name(),
                params.getThresholds(),
                params.getTotalAllowableErrorPercent());
    }
}

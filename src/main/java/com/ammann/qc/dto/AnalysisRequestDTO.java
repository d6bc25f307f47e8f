/* (C)2026 */
package com.ammann.qc.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Batch analysis request. The process is either a configured analyte or given inline through
 * {@code mean} and {@code std}; inline values take precedence over the analyte's target.
 */
@Schema(description = "QC series to analyse together with its target process")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisRequestDTO(
        @Schema(description = "Ordered measurements", required = true)
        List<Double> values,

        @Schema(description = "Configured analyte supplying the process parameters", example = "creatinine")
        String analyte,

        @Schema(description = "Target mean, overrides the analyte's mean")
        Double mean,

        @Schema(description = "Process standard deviation, overrides the analyte's std")
        Double std,

        @Schema(description = "Sensitivity tier: high, medium or low", example = "medium")
        String sensitivity,

        @Schema(description = "Total allowable error in percent for the sigma metric", example = "15")
        Double teaPercent
) {}

/* (C)2026 */
package com.ammann.qc.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Method comparison request. Both methods measured the same samples in the same order.
 */
@Schema(description = "Paired results of two measurement methods")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MethodComparisonRequestDTO(
        @Schema(description = "Reference method results", required = true)
        List<Double> methodA,

        @Schema(description = "Candidate method results, paired by index with methodA", required = true)
        List<Double> methodB,

        @Schema(description = "Named groups for a one-way ANOVA, e.g. results per instrument")
        Map<String, List<Double>> groups,

        @Schema(description = "Analyte the samples were measured for", example = "creatinine")
        String analyte
) {}

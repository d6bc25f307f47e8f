/* (C)2026 */
package com.ammann.qc.dto;

import com.ammann.qc.enumeration.AnalysisStatus;
import com.ammann.qc.model.AnalysisReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Result of a batch QC analysis")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisReportDTO(
        @Schema(description = "Analyte or label of the series")
        String label,

        @Schema(description = "Terminal status of the analysis")
        AnalysisStatus status,

        @Schema(description = "Violations ordered by index")
        List<ViolationDTO> violations,

        @Schema(description = "Counts and verdict")
        SummaryDTO summary,

        @Schema(description = "Descriptive statistics of the series")
        QcStatisticsDTO statistics,

        @Schema(description = "Upper CUSUM per index")
        List<Double> cusumPositive,

        @Schema(description = "Lower CUSUM per index")
        List<Double> cusumNegative,

        @Schema(description = "EWMA per index")
        List<Double> ewma,

        @Schema(description = "EWMA upper control limit")
        Double ewmaUpperLimit,

        @Schema(description = "EWMA lower control limit")
        Double ewmaLowerLimit,

        @Schema(description = "Time the analysis finished")
        Instant analyzedAt
) {
    public static AnalysisReportDTO from(String label, AnalysisReport report, Instant analyzedAt) {
        return new AnalysisReportDTO(
                label,
                report.status(),
                report.merged().violations().stream().map(ViolationDTO::from).toList(),
                SummaryDTO.from(report.merged().summary()),
                QcStatisticsDTO.from(report.statistics()),
                report.cusum().positive(),
                report.cusum().negative(),
                report.ewma().ewma(),
                report.ewma().upperLimit(),
                report.ewma().lowerLimit(),
                analyzedAt);
    }
}

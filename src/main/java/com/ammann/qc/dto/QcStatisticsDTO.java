/* (C)2026 */
package com.ammann.qc.dto;

import com.ammann.qc.model.QcStatistics;
import com.ammann.qc.service.QcStatisticsService;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Descriptive statistics of a series. Value fields are omitted when the series held fewer
 * points than statistics require.
 */
@Schema(description = "Descriptive statistics and sigma metric of a QC series")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QcStatisticsDTO(
        @Schema(description = "Number of values")
        Integer count,

        @Schema(description = "Observed mean")
        Double mean,

        @Schema(description = "Sample standard deviation")
        Double standardDeviation,

        @Schema(description = "Bias against the target mean in percent")
        Double biasPercent,

        @Schema(description = "Coefficient of variation in percent")
        Double cvPercent,

        @Schema(description = "Sigma metric (TEa% - |bias%|) / CV%")
        Double sigma,

        @Schema(description = "Sigma quality class", example = "World Class")
        String sigmaQuality
) {
    public static QcStatisticsDTO from(QcStatistics stats) {
        if (stats.count() < QcStatisticsService.MIN_POINTS) {
            return new QcStatisticsDTO(stats.count(), null, null, null, null, null, null);
        }
        return new QcStatisticsDTO(
                stats.count(),
                stats.mean(),
                stats.standardDeviation(),
                stats.biasPercent(),
                stats.cvPercent(),
                stats.sigmaQuality() != null ? stats.sigma() : null,
                stats.sigmaQuality() != null ? stats.sigmaQuality().getLabel() : null);
    }
}

/* (C)2026 */
package com.ammann.qc.dto;

import com.ammann.qc.model.BlandAltmanResult;
import com.ammann.qc.model.CorrelationResult;
import com.ammann.qc.model.HypothesisTestResult;
import com.ammann.qc.model.MethodComparisonResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Result of a method comparison. Statistics that are undefined for the data, such as a
 * correlation of a constant series, are omitted.
 */
@Schema(description = "Agreement, correlation and significance tests of two methods")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MethodComparisonDTO(
        @Schema(description = "Analyte label", example = "creatinine")
        String analyte,

        @Schema(description = "Number of paired samples")
        int count,

        @Schema(description = "Significance level the tests were judged against", example = "0.05")
        double significance,

        @Schema(description = "Bland-Altman agreement")
        BlandAltmanDTO blandAltman,

        @Schema(description = "Correlation and regression of methodB on methodA")
        CorrelationDTO correlation,

        @Schema(description = "Significance tests")
        List<TestDTO> tests,

        @Schema(description = "Time the comparison was computed")
        Instant generatedAt
) {
    public static MethodComparisonDTO from(
            String analyte, MethodComparisonResult result, Instant generatedAt) {
        return new MethodComparisonDTO(
                analyte,
                result.count(),
                result.significance(),
                BlandAltmanDTO.from(result.blandAltman()),
                CorrelationDTO.from(result.correlation()),
                result.tests().stream().map(TestDTO::from).toList(),
                generatedAt);
    }

    @Schema(description = "Bland-Altman limits of agreement")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BlandAltmanDTO(
            @Schema(description = "Mean of methodA - methodB")
            Double meanDifference,

            @Schema(description = "Standard deviation of the differences")
            Double sdDifference,

            @Schema(description = "Upper limit of agreement")
            Double upperLimit,

            @Schema(description = "Lower limit of agreement")
            Double lowerLimit,

            @Schema(description = "Half-width of the 95% confidence interval of each limit")
            Double limitConfidenceHalfWidth,

            @Schema(description = "Share of differences within the limits in percent", example = "95.0")
            Double withinLimitsPercent
    ) {
        static BlandAltmanDTO from(BlandAltmanResult result) {
            return new BlandAltmanDTO(
                    finite(result.meanDifference()),
                    finite(result.sdDifference()),
                    finite(result.upperLimit()),
                    finite(result.lowerLimit()),
                    finite(result.limitConfidenceHalfWidth()),
                    finite(result.withinLimitsPercent()));
        }
    }

    @Schema(description = "Correlation coefficients and least-squares fit")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CorrelationDTO(
            @Schema(description = "Pearson correlation coefficient")
            Double pearsonR,

            @Schema(description = "p-value of the Pearson correlation")
            Double pearsonP,

            @Schema(description = "Spearman rank correlation coefficient")
            Double spearmanR,

            @Schema(description = "p-value of the Spearman correlation")
            Double spearmanP,

            @Schema(description = "Slope of methodB = slope * methodA + intercept")
            Double slope,

            @Schema(description = "Intercept of the fit")
            Double intercept,

            @Schema(description = "Coefficient of determination")
            Double rSquared
    ) {
        static CorrelationDTO from(CorrelationResult result) {
            return new CorrelationDTO(
                    finite(result.pearsonR()),
                    finite(result.pearsonP()),
                    finite(result.spearmanR()),
                    finite(result.spearmanP()),
                    finite(result.slope()),
                    finite(result.intercept()),
                    finite(result.rSquared()));
        }
    }

    @Schema(description = "Outcome of one significance test")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TestDTO(
            @Schema(description = "Test identifier", example = "PAIRED_T")
            String test,

            @Schema(description = "Display name", example = "Paired t-test")
            String label,

            @Schema(description = "Test statistic (t, U or F)")
            Double statistic,

            @Schema(description = "p-value")
            Double pValue,

            @Schema(description = "Whether the p-value is below the significance level")
            boolean significant
    ) {
        static TestDTO from(HypothesisTestResult result) {
            return new TestDTO(
                    result.test().name(),
                    result.test().getLabel(),
                    finite(result.statistic()),
                    finite(result.pValue()),
                    result.significant());
        }
    }

    private static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }
}

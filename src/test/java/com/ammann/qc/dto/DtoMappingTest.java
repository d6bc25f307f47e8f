/* (C)2026 */
package com.ammann.qc.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.qc.enumeration.AnalysisStatus;
import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.Disposition;
import com.ammann.qc.enumeration.RecommendedAction;
import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.enumeration.SigmaQuality;
import com.ammann.qc.model.AnalysisReport;
import com.ammann.qc.model.CusumResult;
import com.ammann.qc.model.EwmaResult;
import com.ammann.qc.model.MergedReport;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.QcStatistics;
import com.ammann.qc.model.Summary;
import com.ammann.qc.model.Violation;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DtoMappingTest {

    private static final Violation SPIKE =
            Violation.of(
                    10,
                    "1-3s",
                    DetectionMethod.WESTGARD,
                    Severity.CRITICAL,
                    "Value beyond 3 SD",
                    Map.of(Violation.Z_SCORE, 3.5));

    @Nested
    class ViolationMapping {

        @Test
        void copiesAllFields() {
            ViolationDTO dto = ViolationDTO.from(SPIKE);

            assertThat(dto.index()).isEqualTo(10);
            assertThat(dto.source()).isEqualTo("1-3s");
            assertThat(dto.method()).isEqualTo(DetectionMethod.WESTGARD);
            assertThat(dto.action()).isEqualTo(RecommendedAction.REJECT);
            assertThat(dto.evidence()).containsEntry(Violation.Z_SCORE, 3.5);
        }

        @Test
        void emptyEvidenceIsOmitted() {
            Violation plain =
                    Violation.of(3, "8-x", DetectionMethod.WESTGARD, Severity.WARNING, "Run", Map.of());

            assertThat(ViolationDTO.from(plain).evidence()).isNull();
        }
    }

    @Nested
    class StatisticsMapping {

        @Test
        void shortSeriesOnlyCarriesCount() {
            QcStatisticsDTO dto = QcStatisticsDTO.from(QcStatistics.empty(2));

            assertThat(dto.count()).isEqualTo(2);
            assertThat(dto.mean()).isNull();
            assertThat(dto.sigma()).isNull();
        }

        @Test
        void sigmaOnlyWithQualityClass() {
            QcStatistics withTea = new QcStatistics(5, 1.0, 0.02, 1.0, 2.0, 7.0, SigmaQuality.WORLD_CLASS);
            QcStatistics withoutTea = new QcStatistics(5, 1.0, 0.02, 1.0, 2.0, 0.0, null);

            assertThat(QcStatisticsDTO.from(withTea).sigma()).isEqualTo(7.0);
            assertThat(QcStatisticsDTO.from(withTea).sigmaQuality())
                    .isEqualTo(SigmaQuality.WORLD_CLASS.getLabel());
            assertThat(QcStatisticsDTO.from(withoutTea).sigma()).isNull();
            assertThat(QcStatisticsDTO.from(withoutTea).cvPercent()).isEqualTo(2.0);
        }
    }

    @Test
    void analysisReportCarriesSeriesAndLimits() {
        Summary summary =
                new Summary(
                        1,
                        1,
                        0,
                        Map.of(DetectionMethod.WESTGARD, 1),
                        Map.of(Severity.CRITICAL, 1),
                        Disposition.REJECT,
                        "1 critical");
        AnalysisReport report =
                new AnalysisReport(
                        new MergedReport(List.of(SPIKE), summary),
                        new CusumResult(List.of(), List.of(0.0, 3.0), List.of(0.0, 0.0)),
                        new EwmaResult(List.of(), List.of(1.0, 1.035), 1.045, 0.955),
                        QcStatistics.empty(2),
                        AnalysisStatus.REJECT);
        Instant at = Instant.parse("2026-03-01T08:00:00Z");

        AnalysisReportDTO dto = AnalysisReportDTO.from("creatinine", report, at);

        assertThat(dto.label()).isEqualTo("creatinine");
        assertThat(dto.status()).isEqualTo(AnalysisStatus.REJECT);
        assertThat(dto.violations()).extracting(ViolationDTO::source).containsExactly("1-3s");
        assertThat(dto.summary().disposition()).isEqualTo(Disposition.REJECT);
        assertThat(dto.cusumPositive()).containsExactly(0.0, 3.0);
        assertThat(dto.ewma()).containsExactly(1.0, 1.035);
        assertThat(dto.ewmaUpperLimit()).isEqualTo(1.045);
        assertThat(dto.analyzedAt()).isEqualTo(at);
    }

    @Test
    void analyteCarriesThresholdsAndTea() {
        ProcessParameters params =
                ProcessParameters.builder(1.0, 0.05).totalAllowableErrorPercent(15.0).build();

        AnalyteDTO dto = AnalyteDTO.from("creatinine", "mg/dL", params);

        assertThat(dto.name()).isEqualTo("creatinine");
        assertThat(dto.unit()).isEqualTo("mg/dL");
        assertThat(dto.sensitivity()).isEqualTo("MEDIUM");
        assertThat(dto.thresholds().critical()).isEqualTo(3.0);
        assertThat(dto.teaPercent()).isEqualTo(15.0);
    }
}

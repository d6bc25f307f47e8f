/* (C)2026 */
package com.ammann.qc.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.qc.enumeration.Sensitivity;
import com.ammann.qc.exception.ValidationException;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.ThresholdMultipliers;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AnalyteRegistryTest {

    private QcConfig config;
    private QcConfig.Detection detection;
    private final Map<String, QcConfig.Analyte> analytes = new LinkedHashMap<>();

    @BeforeEach
    void setUp() {
        config = mock(QcConfig.class);
        detection = mock(QcConfig.Detection.class);
        when(detection.cusumK()).thenReturn(0.5);
        when(detection.cusumH()).thenReturn(5.0);
        when(detection.ewmaLambda()).thenReturn(0.3);
        when(detection.ewmaL()).thenReturn(3.0);
        when(detection.anomalyThreshold()).thenReturn(3.5);
        when(detection.anomalyCriticalThreshold()).thenReturn(4.5);
        when(detection.trendWindow()).thenReturn(12);
        when(detection.trendSignificance()).thenReturn(0.01);
        when(detection.runWindow()).thenReturn(7);
        when(detection.runMinimum()).thenReturn(6);
        when(detection.zigzagWindow()).thenReturn(8);
        when(detection.zigzagMinReversals()).thenReturn(6);
        when(config.detection()).thenReturn(detection);
        when(config.analytes()).thenReturn(analytes);
        when(config.sensitivity()).thenReturn(Map.of());
    }

    private static QcConfig.Analyte analyte(double mean, double std, String sensitivity, Double tea, String unit) {
        QcConfig.Analyte analyte = mock(QcConfig.Analyte.class);
        when(analyte.mean()).thenReturn(mean);
        when(analyte.std()).thenReturn(std);
        when(analyte.sensitivity()).thenReturn(sensitivity);
        when(analyte.teaPercent()).thenReturn(Optional.ofNullable(tea));
        when(analyte.unit()).thenReturn(Optional.ofNullable(unit));
        return analyte;
    }

    @Test
    void buildsParametersFromConfiguration() {
        analytes.put("urea", analyte(25.0, 1.5, "medium", 9.0, null));
        analytes.put("creatinine", analyte(1.0, 0.05, "high", 15.0, "mg/dL"));

        AnalyteRegistry registry = new AnalyteRegistry(config);

        assertThat(registry.all()).containsOnlyKeys("creatinine", "urea");
        ProcessParameters creatinine = registry.find("creatinine").orElseThrow();
        assertThat(creatinine.getMean()).isEqualTo(1.0);
        assertThat(creatinine.getSensitivity()).isEqualTo(Sensitivity.HIGH);
        assertThat(creatinine.getThresholds()).isEqualTo(new ThresholdMultipliers(1.5, 2.0, 2.5));
        assertThat(creatinine.getCusumH()).isEqualTo(5.0);
        assertThat(creatinine.getEwmaLambda()).isEqualTo(0.3);
        assertThat(creatinine.getTrendWindow()).isEqualTo(12);
        assertThat(creatinine.getTotalAllowableErrorPercent()).isEqualTo(15.0);
        assertThat(registry.unitOf("creatinine")).contains("mg/dL");
        assertThat(registry.unitOf("urea")).isEmpty();
    }

    @Test
    void sensitivityOverridesReplaceDefaults() {
        QcConfig.Tier tier = mock(QcConfig.Tier.class);
        when(tier.warning()).thenReturn(1.8);
        when(tier.alert()).thenReturn(2.2);
        when(tier.critical()).thenReturn(2.8);
        when(config.sensitivity()).thenReturn(Map.of("medium", tier));
        analytes.put("urea", analyte(25.0, 1.5, "medium", null, null));

        AnalyteRegistry registry = new AnalyteRegistry(config);

        assertThat(registry.find("urea").orElseThrow().getThresholds())
                .isEqualTo(new ThresholdMultipliers(1.8, 2.2, 2.8));
        assertThat(registry.sensitivityTable().resolve(Sensitivity.LOW))
                .isEqualTo(new ThresholdMultipliers(2.5, 3.0, 3.5));
    }

    @Test
    void misconfiguredAnalyteFailsWithItsName() {
        analytes.put("glucose", analyte(5.0, 0.0, "medium", null, null));

        assertThatThrownBy(() -> new AnalyteRegistry(config))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("glucose")
                .hasMessageContaining("std");
    }

    @Test
    void unknownSensitivityLabelFailsWithProperty() {
        analytes.put("urea", analyte(25.0, 1.5, "extreme", null, null));

        assertThatThrownBy(() -> new AnalyteRegistry(config))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("qc.analytes.urea.sensitivity");
    }

    @Test
    void unknownAnalyteIsNotFound() {
        AnalyteRegistry registry = new AnalyteRegistry(config);

        assertThat(registry.find("glucose")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({"high,HIGH", "Medium,MEDIUM", "LOW,LOW"})
    void parsesSensitivityLabels(String label, Sensitivity expected) {
        assertThat(AnalyteRegistry.parseSensitivity("sensitivity", label)).isEqualTo(expected);
    }
}

/* (C)2026 */
package com.ammann.qc.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.qc.config.AnalyteRegistry;
import com.ammann.qc.detection.CusumDetector;
import com.ammann.qc.detection.EwmaDetector;
import com.ammann.qc.detection.WestgardRuleEvaluator;
import com.ammann.qc.enumeration.ControlZone;
import com.ammann.qc.exception.ValidationException;
import com.ammann.qc.model.Measurement;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.SensitivityTable;
import com.ammann.qc.model.Violation;
import com.ammann.qc.support.TestDataFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QcMonitorServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    private final ProcessParameters creatinine = TestDataFactory.creatinine();
    private final ProcessParameters urea = ProcessParameters.of(25.0, 1.5);

    private QueuedMeasurementSource source;
    private AnalyteRegistry registry;

    @BeforeEach
    void setUp() {
        source = new QueuedMeasurementSource(100);
        registry =
                new AnalyteRegistry(
                        Map.of("creatinine", creatinine, "urea", urea), SensitivityTable.defaults());
    }

    private QcMonitorService monitor(int bufferSize, int logSize, boolean enabled) {
        IncrementalEvaluator evaluator =
                new IncrementalEvaluator(
                        new WestgardRuleEvaluator(), new CusumDetector(), new EwmaDetector(), false);
        return new QcMonitorService(
                registry,
                evaluator,
                new QcStatisticsService(),
                source,
                bufferSize,
                logSize,
                enabled,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private double sd(ProcessParameters params, double z) {
        return params.getMean() + z * params.getStd();
    }

    @Nested
    @DisplayName("tick")
    class Tick {

        @Test
        void processesOnePointPerAnalyte() {
            QcMonitorService monitor = monitor(10, 5, true);
            source.offer("creatinine", 1.0);
            source.offer("creatinine", 1.01);
            source.offer("urea", 25.0);

            assertThat(monitor.tick()).isEqualTo(2);
            assertThat(monitor.tick()).isEqualTo(1);
            assertThat(monitor.tick()).isZero();

            assertThat(monitor.snapshot("creatinine").orElseThrow().pointCount()).isEqualTo(2);
            assertThat(monitor.snapshot("urea").orElseThrow().pointCount()).isEqualTo(1);
            assertThat(monitor.getLastTick()).isEqualTo(NOW);
        }

        @Test
        void snapshotDescribesLatestPoint() {
            QcMonitorService monitor = monitor(10, 5, true);
            source.offer("creatinine", sd(creatinine, 3.5));
            monitor.tick();

            MonitorSnapshot snapshot = monitor.snapshot("creatinine").orElseThrow();

            assertThat(snapshot.latestValue()).isEqualTo(sd(creatinine, 3.5));
            assertThat(snapshot.latestZone()).isEqualTo(ControlZone.CRITICAL);
            assertThat(snapshot.violationLog()).extracting(Violation::source).contains("1-3s");
            assertThat(snapshot.ewma()).isEqualTo(sd(creatinine, 3.5));
            assertThat(snapshot.updatedAt()).isEqualTo(NOW);
        }

        @Test
        void trailingBufferIsBounded() {
            QcMonitorService monitor = monitor(3, 5, true);
            for (int i = 0; i < 5; i++) {
                source.offer("urea", 25.0 + i * 0.1);
                monitor.tick();
            }

            MonitorSnapshot snapshot = monitor.snapshot("urea").orElseThrow();

            assertThat(snapshot.pointCount()).isEqualTo(5);
            assertThat(snapshot.trailing()).hasSize(3);
            assertThat(snapshot.trailing().get(2)).isCloseTo(25.4, within(1e-9));
            assertThat(snapshot.statistics().count()).isEqualTo(3);
            assertThat(snapshot.trailingMeasurements())
                    .extracting(Measurement::index)
                    .containsExactly(2, 3, 4);
        }

        @Test
        void violationLogKeepsMostRecentEntries() {
            QcMonitorService monitor = monitor(10, 2, true);
            for (int i = 0; i < 4; i++) {
                source.offer("creatinine", sd(creatinine, 3.5));
                monitor.tick();
            }

            MonitorSnapshot snapshot = monitor.snapshot("creatinine").orElseThrow();

            assertThat(snapshot.violationLog()).hasSize(2);
            assertThat(snapshot.violationLog()).allSatisfy(v -> assertThat(v.index()).isEqualTo(3));
        }

        @Test
        void earlierSnapshotsAreNotAffectedByLaterTicks() {
            QcMonitorService monitor = monitor(10, 5, true);
            source.offer("urea", 25.0);
            monitor.tick();
            MonitorSnapshot first = monitor.snapshot("urea").orElseThrow();

            source.offer("urea", 26.0);
            monitor.tick();

            assertThat(first.pointCount()).isEqualTo(1);
            assertThat(first.trailing()).containsExactly(25.0);
            assertThatThrownBy(() -> first.trailing().add(1.0)).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("stop and start")
    class Lifecycle {

        @Test
        void stoppedMonitorLeavesQueueUntouched() {
            QcMonitorService monitor = monitor(10, 5, true);
            monitor.stop();
            source.offer("urea", 25.0);

            assertThat(monitor.tick()).isZero();
            assertThat(monitor.isRunning()).isFalse();
            assertThat(source.pending("urea")).isEqualTo(1);
            assertThat(monitor.getLastTick()).isNull();
        }

        @Test
        void stateSurvivesRestart() {
            QcMonitorService monitor = monitor(10, 5, true);
            source.offer("urea", 25.0);
            monitor.tick();
            monitor.stop();
            monitor.start();
            source.offer("urea", 25.5);
            monitor.tick();

            assertThat(monitor.snapshot("urea").orElseThrow().pointCount()).isEqualTo(2);
        }

        @Test
        void disabledMonitorStartsStopped() {
            QcMonitorService monitor = monitor(10, 5, false);

            assertThat(monitor.isRunning()).isFalse();
            monitor.start();
            assertThat(monitor.isRunning()).isTrue();
        }
    }

    @Test
    void unknownAnalyteHasNoSnapshot() {
        QcMonitorService monitor = monitor(10, 5, true);

        assertThat(monitor.snapshot("glucose")).isEmpty();
        assertThat(monitor.snapshot(null)).isEmpty();
        assertThat(monitor.isMonitored("glucose")).isFalse();
        assertThat(monitor.analytes()).containsExactly("creatinine", "urea");
    }

    @Test
    void freshChannelHasEmptySnapshot() {
        MonitorSnapshot snapshot = monitor(10, 5, true).snapshot("urea").orElseThrow();

        assertThat(snapshot.pointCount()).isZero();
        assertThat(snapshot.latestValue()).isNull();
        assertThat(snapshot.violationLog()).isEmpty();
    }

    @Test
    void extendedRulesNeedBufferForLongestWindow() {
        IncrementalEvaluator extended =
                new IncrementalEvaluator(
                        new WestgardRuleEvaluator(), new CusumDetector(), new EwmaDetector(), true);

        assertThatThrownBy(
                        () ->
                                new QcMonitorService(
                                        registry, extended, new QcStatisticsService(), source, 9, 5, true))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("qc.monitor.buffer-size");
        assertThat(new QcMonitorService(registry, extended, new QcStatisticsService(), source, 10, 5, true)
                        .analytes())
                .containsExactly("creatinine", "urea");
    }

    @Test
    void invalidSizesAreRejected() {
        assertThatThrownBy(() -> monitor(1, 5, true)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> monitor(10, 0, true)).isInstanceOf(ValidationException.class);
    }
}

/* (C)2026 */
package com.ammann.qc.detection;

import static com.ammann.qc.support.TestDataFactory.inSd;
import static com.ammann.qc.support.TestDataFactory.unit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.model.CusumResult;
import com.ammann.qc.model.CusumState;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.Violation;
import com.ammann.qc.support.TestDataFactory;
import java.util.List;
import org.junit.jupiter.api.Test;

class CusumDetectorTest {

    private final CusumDetector detector = new CusumDetector();
    private final ProcessParameters params = unit();

    @Test
    void flatSeriesAtMeanKeepsBothSumsAtZero() {
        CusumResult result = detector.detect(TestDataFactory.flat(30, 0.0), params);

        assertThat(result.violations()).isEmpty();
        assertThat(result.positive()).hasSize(30).containsOnly(0.0);
        assertThat(result.negative()).hasSize(30).containsOnly(0.0);
    }

    @Test
    void sumsStayNonNegativeForNoisySeries() {
        CusumResult result =
                detector.detect(TestDataFactory.noisy(params, 200, 3.0, 7L), params);

        assertThat(result.positive()).allMatch(v -> v >= 0.0);
        assertThat(result.negative()).allMatch(v -> v >= 0.0);
    }

    @Test
    void firstPointSeedsFromZero() {
        CusumState state = detector.step(CusumState.initial(), 1.5, params);

        assertThat(state.positive()).isCloseTo(1.0, within(1e-12));
        assertThat(state.negative()).isZero();
        assertThat(state.count()).isEqualTo(1);
    }

    @Test
    void sustainedUpwardShiftFiresAndKeepsFiring() {
        // z = 1.5 per point accumulates 1.0 per step: 1, 2, 3, 4, 5, 6
        CusumResult result = detector.detect(inSd(params, 1.5, 1.5, 1.5, 1.5, 1.5, 1.5), params);

        assertThat(result.violations())
                .extracting(Violation::index)
                .containsExactly(4, 5);
        assertThat(result.violations())
                .allMatch(v -> v.source().equals(CusumDetector.CUSUM_HIGH))
                .allMatch(v -> v.severity() == Severity.CRITICAL);
        assertThat(result.violations().get(0).evidence().get(CusumDetector.EVIDENCE_KEY))
                .isCloseTo(5.0, within(1e-9));
    }

    @Test
    void sumEqualToDecisionIntervalDoesNotFire() {
        CusumResult result = detector.detect(inSd(params, 1.5, 1.5, 1.5, 1.5), params);

        assertThat(result.positive().get(3)).isCloseTo(4.0, within(1e-12));
        assertThat(result.violations()).isEmpty();
    }

    @Test
    void downwardShiftRaisesCusumLow() {
        CusumResult result = detector.detect(inSd(params, -2.0, -2.0, -2.0), params);

        assertThat(result.violations())
                .extracting(Violation::source)
                .containsExactly(CusumDetector.CUSUM_LOW);
        assertThat(result.violations().get(0).index()).isEqualTo(2);
    }

    @Test
    void batchEqualsFoldedSteps() {
        List<Double> series = TestDataFactory.noisy(params, 50, 2.5, 11L);
        CusumResult batch = detector.detect(series, params);

        CusumState state = CusumState.initial();
        for (int i = 0; i < series.size(); i++) {
            state = detector.step(state, series.get(i), params);
            assertThat(batch.positive().get(i)).isEqualTo(state.positive());
            assertThat(batch.negative().get(i)).isEqualTo(state.negative());
        }
    }
}

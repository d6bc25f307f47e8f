/* (C)2026 */
package com.ammann.qc.detection;

import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.model.CusumResult;
import com.ammann.qc.model.CusumState;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.Violation;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Tabular CUSUM chart for small sustained shifts.
 *
 * <p>Both sums are floored at zero and never reset after a signal: a persisting shift keeps
 * firing at every index until the sum falls back below {@code h}.
 */
@ApplicationScoped
public class CusumDetector {

    private static final Logger LOG = Logger.getLogger(CusumDetector.class);

    public static final String CUSUM_HIGH = "CUSUM_HIGH";
    public static final String CUSUM_LOW = "CUSUM_LOW";
    public static final String EVIDENCE_KEY = "cusum";

    /**
     * Folds one value into the running sums.
     *
     * @param state  sums before the value
     * @param value  new measurement
     * @param params process parameters
     * @return sums after the value
     */
    public CusumState step(CusumState state, double value, ProcessParameters params) {
        double z = params.zScore(value);
        double k = params.getCusumK();
        double positive = Math.max(0.0, state.positive() + z - k);
        double negative = Math.max(0.0, state.negative() - z - k);
        return new CusumState(positive, negative, state.count() + 1);
    }

    /**
     * Checks the sums of one index against the decision interval.
     *
     * @param index  series index the state belongs to
     * @param state  sums after folding in the value at {@code index}
     * @param params process parameters
     * @return zero, one or two violations
     */
    public List<Violation> violationsAt(int index, CusumState state, ProcessParameters params) {
        double h = params.getCusumH();
        List<Violation> found = new ArrayList<>(2);
        if (state.positive() > h) {
            found.add(
                    Violation.of(
                            index,
                            CUSUM_HIGH,
                            DetectionMethod.CUSUM,
                            Severity.CRITICAL,
                            String.format(
                                    "Upward shift detected (CUSUM+ = %.2f > h = %.2f)",
                                    state.positive(), h),
                            Map.of(EVIDENCE_KEY, state.positive())));
        }
        if (state.negative() > h) {
            found.add(
                    Violation.of(
                            index,
                            CUSUM_LOW,
                            DetectionMethod.CUSUM,
                            Severity.CRITICAL,
                            String.format(
                                    "Downward shift detected (CUSUM- = %.2f > h = %.2f)",
                                    state.negative(), h),
                            Map.of(EVIDENCE_KEY, state.negative())));
        }
        return found;
    }

    /**
     * Runs the chart over a whole series from a fresh state.
     *
     * @param series ordered measurements
     * @param params process parameters
     * @return violations and both accumulator series
     */
    public CusumResult detect(List<Double> series, ProcessParameters params) {
        SeriesSupport.requireParameters(params);
        double[] values = SeriesSupport.snapshot(series);
        List<Double> positive = new ArrayList<>(values.length);
        List<Double> negative = new ArrayList<>(values.length);
        List<Violation> violations = new ArrayList<>();

        CusumState state = CusumState.initial();
        for (int i = 0; i < values.length; i++) {
            state = step(state, values[i], params);
            positive.add(state.positive());
            negative.add(state.negative());
            violations.addAll(violationsAt(i, state, params));
        }

        LOG.debugf(
                "CUSUM: %d violations over %d points (final CUSUM+ = %.3f, CUSUM- = %.3f)",
                violations.size(), values.length, state.positive(), state.negative());
        return new CusumResult(violations, positive, negative);
    }
}

/* (C)2026 */
package com.ammann.qc.detection;

import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.model.EwmaResult;
import com.ammann.qc.model.EwmaState;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.Violation;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Exponentially weighted moving average chart for gradual drift.
 *
 * <p>The first value seeds the average and is never flagged. Control limits are the
 * asymptotic ones, {@code mean ± L * std * sqrt(lambda / (2 - lambda))}.
 */
@ApplicationScoped
public class EwmaDetector {

    private static final Logger LOG = Logger.getLogger(EwmaDetector.class);

    public static final String EWMA_HIGH = "EWMA_HIGH";
    public static final String EWMA_LOW = "EWMA_LOW";
    public static final String EVIDENCE_KEY = "ewma";

    /**
     * Folds one value into the weighted average.
     *
     * @param state  average before the value
     * @param value  new measurement
     * @param params process parameters
     * @return average after the value
     */
    public EwmaState step(EwmaState state, double value, ProcessParameters params) {
        if (!state.isSeeded()) {
            return new EwmaState(value, 1);
        }
        double lambda = params.getEwmaLambda();
        return new EwmaState(lambda * value + (1.0 - lambda) * state.value(), state.count() + 1);
    }

    /**
     * Checks the average of one index against the control limits.
     *
     * @param index  series index the state belongs to
     * @param state  average after folding in the value at {@code index}
     * @param params process parameters
     * @return at most one violation; none for the seed point
     */
    public List<Violation> violationsAt(int index, EwmaState state, ProcessParameters params) {
        if (state.count() < 2) {
            return List.of();
        }
        double ucl = params.ewmaUpperLimit();
        double lcl = params.ewmaLowerLimit();
        if (state.value() > ucl) {
            return List.of(
                    Violation.of(
                            index,
                            EWMA_HIGH,
                            DetectionMethod.EWMA,
                            Severity.WARNING,
                            String.format(
                                    "EWMA exceeds upper limit (%.4f > %.4f)", state.value(), ucl),
                            Map.of(EVIDENCE_KEY, state.value())));
        }
        if (state.value() < lcl) {
            return List.of(
                    Violation.of(
                            index,
                            EWMA_LOW,
                            DetectionMethod.EWMA,
                            Severity.WARNING,
                            String.format(
                                    "EWMA below lower limit (%.4f < %.4f)", state.value(), lcl),
                            Map.of(EVIDENCE_KEY, state.value())));
        }
        return List.of();
    }

    /**
     * Runs the chart over a whole series from a fresh state.
     *
     * @param series ordered measurements
     * @param params process parameters
     * @return violations, the smoothed series and the control limits
     */
    public EwmaResult detect(List<Double> series, ProcessParameters params) {
        SeriesSupport.requireParameters(params);
        double[] values = SeriesSupport.snapshot(series);
        List<Double> ewma = new ArrayList<>(values.length);
        List<Violation> violations = new ArrayList<>();

        EwmaState state = EwmaState.initial();
        for (int i = 0; i < values.length; i++) {
            state = step(state, values[i], params);
            ewma.add(state.value());
            violations.addAll(violationsAt(i, state, params));
        }

        LOG.debugf("EWMA: %d violations over %d points", violations.size(), values.length);
        return new EwmaResult(
                violations, ewma, params.ewmaUpperLimit(), params.ewmaLowerLimit());
    }
}

/* (C)2026 */
package com.ammann.qc.service;

import com.ammann.qc.detection.CusumDetector;
import com.ammann.qc.detection.EwmaDetector;
import com.ammann.qc.detection.WestgardRule;
import com.ammann.qc.detection.WestgardRuleEvaluator;
import com.ammann.qc.exception.ValidationException;
import com.ammann.qc.model.CusumState;
import com.ammann.qc.model.EwmaState;
import com.ammann.qc.model.IncrementalResult;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.StreamingState;
import com.ammann.qc.model.Violation;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Evaluates one new measurement against retained state only.
 *
 * <p>The default rule set is 1-3s, 2-2s, R-4s plus CUSUM and EWMA. With extended rules
 * enabled the remaining Westgard rules run over the trailing buffer as well, so the buffer
 * must hold at least {@link #requiredBufferSize()} points. Violations for one point are emitted in the
 * same order the batch path uses: Westgard rules, then CUSUM, then EWMA.
 */
@ApplicationScoped
public class IncrementalEvaluator {

    private static final Logger LOG = Logger.getLogger(IncrementalEvaluator.class);

    private final WestgardRuleEvaluator westgard;
    private final CusumDetector cusum;
    private final EwmaDetector ewma;
    private final Set<WestgardRule> rules;
    private final int requiredBufferSize;

    @Inject
    public IncrementalEvaluator(
            WestgardRuleEvaluator westgard,
            CusumDetector cusum,
            EwmaDetector ewma,
            @ConfigProperty(name = "qc.monitor.extended-rules", defaultValue = "false")
                    boolean extendedRules) {
        this.westgard = westgard;
        this.cusum = cusum;
        this.ewma = ewma;
        this.rules =
                Collections.unmodifiableSet(
                        extendedRules
                                ? EnumSet.allOf(WestgardRule.class)
                                : EnumSet.copyOf(WestgardRule.SHORT_WINDOW));
        this.requiredBufferSize = Math.max(2, WestgardRule.longestWindow(rules));
    }

    /**
     * Folds a new point into the state and reports the violations it raises.
     *
     * @param value  new measurement
     * @param state  state before the point
     * @param params process parameters
     * @return new state and the violations at the new point's index
     * @throws ValidationException if the value is not finite or the state's buffer is shorter
     *     than the longest active rule window
     */
    public IncrementalResult evaluateIncremental(
            double value, StreamingState state, ProcessParameters params) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(params, "params");
        if (!Double.isFinite(value)) {
            throw ValidationException.invalidParameter("value", value, "finite number");
        }
        if (state.capacity() < requiredBufferSize) {
            throw ValidationException.invalidParameter(
                    "capacity", state.capacity(), "at least " + requiredBufferSize + " for " + rules);
        }

        int index = state.nextIndex();
        CusumState nextCusum = cusum.step(state.cusum(), value, params);
        EwmaState nextEwma = ewma.step(state.ewma(), value, params);
        StreamingState next = state.append(value, nextCusum, nextEwma);

        List<Violation> violations = new ArrayList<>(westgard.evaluateLatest(
                next.trailingValues(), index, params, rules));
        violations.addAll(cusum.violationsAt(index, nextCusum, params));
        violations.addAll(ewma.violationsAt(index, nextEwma, params));

        if (!violations.isEmpty()) {
            LOG.debugf(
                    "Point %d (%.4f): %d violations",
                    Integer.valueOf(index),
                    Double.valueOf(value),
                    Integer.valueOf(violations.size()));
        }
        return new IncrementalResult(next, violations);
    }

    /** Smallest trailing buffer that lets every active rule see its full window. */
    public int requiredBufferSize() {
        return requiredBufferSize;
    }

    /** Westgard rules applied to each new point. */
    public Set<WestgardRule> getRules() {
        return rules;
    }
}

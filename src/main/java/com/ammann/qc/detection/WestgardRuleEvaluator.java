/* (C)2026 */
package com.ammann.qc.detection;

import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.Violation;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Applies the Westgard multi-rule set to a measurement series.
 *
 * <p>Every rule is evaluated independently at every index, so one point may raise several
 * violations. Indices with less history than a rule needs are skipped for that rule.
 */
@ApplicationScoped
public class WestgardRuleEvaluator {

    private static final Logger LOG = Logger.getLogger(WestgardRuleEvaluator.class);

    /**
     * Evaluates all rules over the whole series.
     *
     * @param series ordered measurements
     * @param params process parameters
     * @return violations ordered by index, then by rule
     */
    public List<Violation> detect(List<Double> series, ProcessParameters params) {
        return detect(series, params, EnumSet.allOf(WestgardRule.class));
    }

    /**
     * Evaluates a subset of rules over the whole series.
     *
     * @param series ordered measurements
     * @param params process parameters
     * @param rules  rules to apply
     * @return violations ordered by index, then by rule
     */
    public List<Violation> detect(
            List<Double> series, ProcessParameters params, Set<WestgardRule> rules) {
        SeriesSupport.requireParameters(params);
        double[] values = SeriesSupport.snapshot(series);
        List<Violation> violations = new ArrayList<>();

        for (int i = 0; i < values.length; i++) {
            violations.addAll(evaluate(values, i, i, params, rules));
        }

        LOG.debugf("Westgard rules: %d violations over %d points", violations.size(), values.length);
        return violations;
    }

    /**
     * Evaluates rules for the last value of a trailing buffer.
     *
     * @param trailing      trailing values, oldest first, ending with the point under test
     * @param reportedIndex series index of the point under test
     * @param params        process parameters
     * @param rules         rules to apply
     * @return violations raised by the newest point
     */
    public List<Violation> evaluateLatest(
            double[] trailing,
            int reportedIndex,
            ProcessParameters params,
            Collection<WestgardRule> rules) {
        if (trailing.length == 0) {
            return List.of();
        }
        return evaluate(trailing, trailing.length - 1, reportedIndex, params, rules);
    }

    private List<Violation> evaluate(
            double[] values,
            int position,
            int reportedIndex,
            ProcessParameters params,
            Collection<WestgardRule> rules) {
        List<Violation> found = new ArrayList<>(2);
        for (WestgardRule rule : WestgardRule.values()) {
            if (rules.contains(rule)) {
                rule.evaluateAt(values, position, reportedIndex, params).ifPresent(found::add);
            }
        }
        return found;
    }
}

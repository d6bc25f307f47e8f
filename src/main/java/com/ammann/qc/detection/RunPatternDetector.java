/* (C)2026 */
package com.ammann.qc.detection;

import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.Violation;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Scans trailing windows for same-side runs ({@code RUN_RULE_6/7}) and excessive
 * alternation ({@code ZIGZAG_PATTERN}).
 */
@ApplicationScoped
public class RunPatternDetector {

    private static final Logger LOG = Logger.getLogger(RunPatternDetector.class);

    /**
     * @param series ordered measurements
     * @param params process parameters (run and zigzag windows)
     * @return pattern findings ordered by index, run rule before zigzag
     */
    public List<Violation> detect(List<Double> series, ProcessParameters params) {
        SeriesSupport.requireParameters(params);
        double[] values = SeriesSupport.snapshot(series);
        List<Violation> patterns = new ArrayList<>();

        for (int i = 0; i < values.length; i++) {
            for (RunPatternRule rule : RunPatternRule.values()) {
                rule.evaluateAt(values, i, i, params).ifPresent(patterns::add);
            }
        }

        LOG.debugf("Run analysis: %d patterns over %d points", patterns.size(), values.length);
        return patterns;
    }
}

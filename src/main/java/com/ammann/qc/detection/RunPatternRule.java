/* (C)2026 */
package com.ammann.qc.detection;

import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.Violation;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Run and pattern rules over the trailing points of a series.
 *
 * <p>Only strict same-side majorities count for the run rule: a value equal to the mean is
 * neither above nor below it, and points alternating around the mean never form a run.
 */
public enum RunPatternRule implements WindowRule {
    RUN_RULE_6_OF_7("RUN_RULE_6/7") {
        @Override
        public int windowSize(ProcessParameters p) {
            return p.getRunWindow();
        }

        @Override
        public boolean matches(double[] w, ProcessParameters p) {
            return countAbove(w, p) >= p.getRunMinimum() || countBelow(w, p) >= p.getRunMinimum();
        }

        @Override
        public String describe(double[] w, ProcessParameters p) {
            return String.format(
                    "%d out of %d points on the same side of the mean (potential bias)",
                    Math.max(countAbove(w, p), countBelow(w, p)), w.length);
        }

        @Override
        public Map<String, Double> evidence(double[] w, ProcessParameters p) {
            Map<String, Double> evidence = new LinkedHashMap<>();
            evidence.put(Violation.Z_SCORE, p.zScore(w[w.length - 1]));
            evidence.put("above", (double) countAbove(w, p));
            evidence.put("below", (double) countBelow(w, p));
            return evidence;
        }
    },
    ZIGZAG_PATTERN("ZIGZAG_PATTERN") {
        @Override
        public int windowSize(ProcessParameters p) {
            return p.getZigzagWindow();
        }

        @Override
        public boolean matches(double[] w, ProcessParameters p) {
            return signReversals(w) >= p.getZigzagMinReversals();
        }

        @Override
        public String describe(double[] w, ProcessParameters p) {
            return String.format(
                    "Excessive alternation: %d sign reversals across %d points",
                    signReversals(w), w.length);
        }

        @Override
        public Map<String, Double> evidence(double[] w, ProcessParameters p) {
            Map<String, Double> evidence = new LinkedHashMap<>();
            evidence.put(Violation.Z_SCORE, p.zScore(w[w.length - 1]));
            evidence.put("reversals", (double) signReversals(w));
            return evidence;
        }
    };

    private final String code;

    RunPatternRule(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.RUN;
    }

    @Override
    public Severity severity() {
        return Severity.WARNING;
    }

    static int countAbove(double[] w, ProcessParameters p) {
        int count = 0;
        for (double value : w) {
            if (value > p.getMean()) count++;
        }
        return count;
    }

    static int countBelow(double[] w, ProcessParameters p) {
        int count = 0;
        for (double value : w) {
            if (value < p.getMean()) count++;
        }
        return count;
    }

    /**
     * Counts sign changes between consecutive differences; a zero difference has sign 0.
     */
    static int signReversals(double[] w) {
        int reversals = 0;
        for (int i = 2; i < w.length; i++) {
            double previous = Math.signum(w[i - 1] - w[i - 2]);
            double current = Math.signum(w[i] - w[i - 1]);
            if (previous != current) {
                reversals++;
            }
        }
        return reversals;
    }
}

/* (C)2026 */
package com.ammann.qc.detection;

import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.Violation;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Westgard multi-rule set for Levey-Jennings control charts.
 *
 * <p>Declaration order is the per-index evaluation order. Limits are compared on the raw
 * deviation {@code |value - mean| > n * std}, so a value exactly on a limit does not fire.
 */
public enum WestgardRule implements WindowRule {
    RULE_1_3S(
            "1-3s",
            Severity.CRITICAL,
            1,
            "Single value exceeds ±3 SD (random error)") {
        @Override
        public boolean matches(double[] w, ProcessParameters p) {
            return beyond(w[0], 3.0, p);
        }
    },
    RULE_2_2S(
            "2-2s",
            Severity.CRITICAL,
            2,
            "Two consecutive values exceed ±2 SD on the same side (systematic error)") {
        @Override
        public boolean matches(double[] w, ProcessParameters p) {
            return beyond(w[0], 2.0, p)
                    && beyond(w[1], 2.0, p)
                    && side(w[0], p) == side(w[1], p);
        }
    },
    RULE_R_4S(
            "R-4s",
            Severity.CRITICAL,
            2,
            "Range between consecutive values exceeds 4 SD (random error)") {
        @Override
        public boolean matches(double[] w, ProcessParameters p) {
            return Math.abs(w[1] - w[0]) > 4.0 * p.getStd();
        }

        @Override
        public Map<String, Double> evidence(double[] w, ProcessParameters p) {
            Map<String, Double> evidence = new LinkedHashMap<>();
            evidence.put(Violation.Z_SCORE, p.zScore(w[1]));
            evidence.put("rangeSd", Math.abs(w[1] - w[0]) / p.getStd());
            return evidence;
        }
    },
    RULE_4_1S(
            "4-1s",
            Severity.WARNING,
            4,
            "Four consecutive values exceed ±1 SD on the same side (shift)") {
        @Override
        public boolean matches(double[] w, ProcessParameters p) {
            return allBeyondOnSide(w, 1.0, p, 1) || allBeyondOnSide(w, 1.0, p, -1);
        }
    },
    RULE_10_X(
            "10-x",
            Severity.CRITICAL,
            10,
            "Ten consecutive values on the same side of the mean (systematic bias)") {
        @Override
        public boolean matches(double[] w, ProcessParameters p) {
            return allOnSide(w, p, 1) || allOnSide(w, p, -1);
        }
    },
    RULE_7_T(
            "7-T",
            Severity.WARNING,
            7,
            "Seven consecutive values trending in one direction") {
        @Override
        public boolean matches(double[] w, ProcessParameters p) {
            return strictlyMonotonic(w);
        }
    },
    RULE_6_X(
            "6-x",
            Severity.WARNING,
            6,
            "Six consecutive values trending in one direction") {
        @Override
        public boolean matches(double[] w, ProcessParameters p) {
            return strictlyMonotonic(w);
        }
    },
    RULE_8_X(
            "8-x",
            Severity.WARNING,
            8,
            "Eight consecutive values avoid the ±1 SD band (increased variability)") {
        @Override
        public boolean matches(double[] w, ProcessParameters p) {
            for (double value : w) {
                if (!beyond(value, 1.0, p)) {
                    return false;
                }
            }
            return true;
        }
    };

    /** Rules that only need the current and the previous point. */
    public static final Set<WestgardRule> SHORT_WINDOW =
            EnumSet.of(RULE_1_3S, RULE_2_2S, RULE_R_4S);

    private final String code;
    private final Severity severity;
    private final int windowSize;
    private final String description;

    WestgardRule(String code, Severity severity, int windowSize, String description) {
        this.code = code;
        this.severity = severity;
        this.windowSize = windowSize;
        this.description = description;
    }

    @Override
    public String code() {
        return code;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.WESTGARD;
    }

    @Override
    public Severity severity() {
        return severity;
    }

    @Override
    public int windowSize(ProcessParameters params) {
        return windowSize;
    }

    @Override
    public String describe(double[] window, ProcessParameters params) {
        return description;
    }

    /**
     * Longest window among the given rules.
     *
     * @param rules rule set
     * @return number of trailing points the rules need, 0 for an empty set
     */
    public static int longestWindow(Collection<WestgardRule> rules) {
        int longest = 0;
        for (WestgardRule rule : rules) {
            longest = Math.max(longest, rule.windowSize);
        }
        return longest;
    }

    static boolean beyond(double value, double multiple, ProcessParameters p) {
        return Math.abs(value - p.getMean()) > multiple * p.getStd();
    }

    static int side(double value, ProcessParameters p) {
        return (int) Math.signum(value - p.getMean());
    }

    private static boolean allBeyondOnSide(
            double[] w, double multiple, ProcessParameters p, int side) {
        for (double value : w) {
            if (side(value, p) != side || !beyond(value, multiple, p)) {
                return false;
            }
        }
        return true;
    }

    private static boolean allOnSide(double[] w, ProcessParameters p, int side) {
        for (double value : w) {
            if (side(value, p) != side) {
                return false;
            }
        }
        return true;
    }

    static boolean strictlyMonotonic(double[] w) {
        boolean increasing = true;
        boolean decreasing = true;
        for (int i = 1; i < w.length; i++) {
            double diff = w[i] - w[i - 1];
            increasing &= diff > 0;
            decreasing &= diff < 0;
        }
        return increasing || decreasing;
    }
}

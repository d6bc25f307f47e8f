/* (C)2026 */
package com.ammann.qc.detection;

import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.Violation;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * A control rule evaluated on a fixed-size trailing window that ends at the point under test.
 *
 * <p>Implementations are pure: the outcome depends only on the window and the process
 * parameters, so the same rule serves the batch scan and the incremental stream.
 */
public interface WindowRule {

    /** Rule id reported as the violation source. */
    String code();

    DetectionMethod method();

    Severity severity();

    /**
     * @param params process parameters (some rules size their window from them)
     * @return number of points the rule inspects, including the point under test
     */
    int windowSize(ProcessParameters params);

    /**
     * @param window exactly {@link #windowSize(ProcessParameters)} values, oldest first
     * @param params process parameters
     * @return whether the rule fires for the last point of the window
     */
    boolean matches(double[] window, ProcessParameters params);

    /** Human-readable explanation of a firing. */
    String describe(double[] window, ProcessParameters params);

    /** Numbers backing a firing; defaults to the z-score of the point under test. */
    default Map<String, Double> evidence(double[] window, ProcessParameters params) {
        return Map.of(Violation.Z_SCORE, params.zScore(window[window.length - 1]));
    }

    /**
     * Evaluates the rule for the point at {@code position} of {@code values}.
     *
     * <p>Positions with less history than the window are skipped, not treated as errors.
     *
     * @param values        series or trailing buffer, oldest first
     * @param position      position of the point under test inside {@code values}
     * @param reportedIndex series index to report for the point
     * @param params        process parameters
     * @return the violation, or empty when the rule does not fire or lacks history
     */
    default Optional<Violation> evaluateAt(
            double[] values, int position, int reportedIndex, ProcessParameters params) {
        int size = windowSize(params);
        if (position + 1 < size) {
            return Optional.empty();
        }
        double[] window = Arrays.copyOfRange(values, position - size + 1, position + 1);
        if (!matches(window, params)) {
            return Optional.empty();
        }
        return Optional.of(
                Violation.of(
                        reportedIndex,
                        code(),
                        method(),
                        severity(),
                        describe(window, params),
                        evidence(window, params)));
    }
}

/* (C)2026 */
package com.ammann.qc.detection;

import com.ammann.qc.exception.ValidationException;
import com.ammann.qc.model.ProcessParameters;
import java.util.List;
import java.util.Objects;

/**
 * Input checks shared by all detectors.
 */
public final class SeriesSupport {

    private SeriesSupport() {}

    /**
     * Copies a measurement series into an array, rejecting empty input and non-finite values.
     *
     * @param series ordered measurements
     * @return snapshot of the series
     * @throws ValidationException if the series is null, empty or contains NaN/infinity
     */
    public static double[] snapshot(List<Double> series) {
        if (series == null || series.isEmpty()) {
            throw ValidationException.insufficientData("measurements", 1, 0);
        }
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            Double value = series.get(i);
            if (value == null || !Double.isFinite(value)) {
                throw ValidationException.invalidParameter(
                        "series[" + i + "]", value, "finite number");
            }
            values[i] = value;
        }
        return values;
    }

    static ProcessParameters requireParameters(ProcessParameters params) {
        return Objects.requireNonNull(params, "process parameters must not be null");
    }
}

/* (C)2026 */
package com.ammann.qc.detection;

import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.exception.ValidationException;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.Violation;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.jboss.logging.Logger;

/**
 * Sliding-window linear trend detection.
 *
 * <p>For every index {@code i >= window} an ordinary least-squares line is fitted to the
 * {@code window} values preceding {@code i}. A finding needs both a significant slope
 * ({@code p < significance}) and a large total change over the window, measured in standard
 * deviations ({@code |slope * window / std| > warning change}).
 */
@ApplicationScoped
public class TrendDetector {

    private static final Logger LOG = Logger.getLogger(TrendDetector.class);

    public static final String TREND_UPWARD = "TREND_UPWARD";
    public static final String TREND_DOWNWARD = "TREND_DOWNWARD";

    /**
     * Scans the series with the configured trend window.
     *
     * @param series ordered measurements, longer than the trend window
     * @param params process parameters (window, significance, change thresholds)
     * @return trend findings ordered by index
     * @throws ValidationException if the window does not fit the series
     */
    public List<Violation> detect(List<Double> series, ProcessParameters params) {
        SeriesSupport.requireParameters(params);
        double[] values = SeriesSupport.snapshot(series);
        int window = params.getTrendWindow();
        if (window >= values.length) {
            throw ValidationException.invalidParameter(
                    "trendWindow", window, "value smaller than the series length " + values.length);
        }

        List<Violation> trends = new ArrayList<>();
        for (int i = window; i < values.length; i++) {
            SimpleRegression regression = new SimpleRegression();
            for (int x = 0; x < window; x++) {
                regression.addData(x, values[i - window + x]);
            }

            double pValue = regression.getSignificance();
            if (Double.isNaN(pValue) || pValue >= params.getTrendSignificance()) {
                continue;
            }

            double slope = regression.getSlope();
            double change = slope * window / params.getStd();
            double magnitude = Math.abs(change);
            if (magnitude <= params.getTrendWarningChange()) {
                continue;
            }

            Severity severity =
                    magnitude > params.getTrendCriticalChange()
                            ? Severity.CRITICAL
                            : Severity.WARNING;
            boolean upward = slope > 0;
            double rSquared = regression.getRSquare();

            Map<String, Double> evidence = new LinkedHashMap<>();
            evidence.put("slope", slope);
            evidence.put("intercept", regression.getIntercept());
            evidence.put("r", regression.getR());
            evidence.put("rSquared", rSquared);
            evidence.put("pValue", pValue);
            evidence.put("changeInSd", change);

            trends.add(
                    Violation.of(
                            i,
                            upward ? TREND_UPWARD : TREND_DOWNWARD,
                            DetectionMethod.TREND,
                            severity,
                            String.format(
                                    "%s trend (slope=%.4f, R²=%.3f, change=%.2f SD)",
                                    upward ? "Upward" : "Downward", slope, rSquared, change),
                            evidence));
        }

        LOG.debugf(
                "Trend detection: %d findings over %d windows of %d points",
                trends.size(), values.length - window, window);
        return trends;
    }
}

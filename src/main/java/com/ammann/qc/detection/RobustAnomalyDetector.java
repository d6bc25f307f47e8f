/* (C)2026 */
package com.ammann.qc.detection;

import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.Violation;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.jboss.logging.Logger;

/**
 * Outlier detection with the modified z-score {@code 0.6745 * (x - median) / MAD}.
 *
 * <p>Median and median absolute deviation are taken over the whole series, so this detector
 * only runs in batch mode. A series whose MAD is zero has no defined score and yields no
 * anomalies.
 */
@ApplicationScoped
public class RobustAnomalyDetector {

    private static final Logger LOG = Logger.getLogger(RobustAnomalyDetector.class);

    public static final String STATISTICAL_ANOMALY = "STATISTICAL_ANOMALY";
    static final double CONSISTENCY_CONSTANT = 0.6745;

    /**
     * Flags points whose modified z-score exceeds the anomaly thresholds.
     *
     * @param series ordered measurements
     * @param params process parameters (anomaly thresholds)
     * @return anomalies ordered by index
     */
    public List<Violation> detect(List<Double> series, ProcessParameters params) {
        SeriesSupport.requireParameters(params);
        double[] values = SeriesSupport.snapshot(series);

        Median median = new Median();
        double center = median.evaluate(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        double mad = median.evaluate(deviations);

        if (mad == 0.0) {
            LOG.debugf(
                    "Median absolute deviation is zero over %d points, modified z-score undefined",
                    values.length);
            return List.of();
        }

        List<Violation> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double modifiedZ = CONSISTENCY_CONSTANT * (values[i] - center) / mad;
            double magnitude = Math.abs(modifiedZ);
            if (magnitude <= params.getAnomalyThreshold()) {
                continue;
            }
            Severity severity =
                    magnitude > params.getAnomalyCriticalThreshold()
                            ? Severity.CRITICAL
                            : Severity.WARNING;

            Map<String, Double> evidence = new LinkedHashMap<>();
            evidence.put("modifiedZScore", modifiedZ);
            evidence.put("median", center);
            evidence.put("mad", mad);

            anomalies.add(
                    Violation.of(
                            i,
                            STATISTICAL_ANOMALY,
                            DetectionMethod.ANOMALY,
                            severity,
                            String.format("Statistical outlier (modified Z = %.2f)", modifiedZ),
                            evidence));
        }

        LOG.debugf(
                "Robust anomaly detection: %d anomalies (median=%.4f, MAD=%.4f)",
                Integer.valueOf(anomalies.size()), Double.valueOf(center), Double.valueOf(mad));
        return anomalies;
    }
}

/* (C)2026 */
package com.ammann.qc.service;

import com.ammann.qc.detection.SeriesSupport;
import com.ammann.qc.enumeration.SigmaQuality;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.QcStatistics;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.jboss.logging.Logger;

/**
 * Descriptive statistics and six-sigma capability of a QC series.
 *
 * <p>Bias is measured against the target mean of the process, CV against the observed mean.
 * Both percentages are 0 when their denominator is 0. The sigma metric is {@code (TEa% - |bias%|) / CV%} and needs a configured total allowable
 * error; without one it is reported as 0 with no quality class.
 */
@ApplicationScoped
public class QcStatisticsService {

    private static final Logger LOG = Logger.getLogger(QcStatisticsService.class);

    /** Minimum number of values before statistics are reported. */
    public static final int MIN_POINTS = 3;

    /**
     * @param series ordered measurements
     * @param params process parameters with target mean and optional TEa
     * @return statistics, or {@link QcStatistics#empty(int)} for fewer than {@value #MIN_POINTS}
     *     values
     */
    public QcStatistics calculate(List<Double> series, ProcessParameters params) {
        double[] values = SeriesSupport.snapshot(series);
        return calculate(values, params);
    }

    QcStatistics calculate(double[] values, ProcessParameters params) {
        if (values.length < MIN_POINTS) {
            LOG.debugf("Statistics skipped: %d points < %d", values.length, MIN_POINTS);
            return QcStatistics.empty(values.length);
        }

        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        double mean = stats.getMean();
        double sd = stats.getStandardDeviation();
        double cv = mean != 0.0 ? sd / Math.abs(mean) * 100.0 : 0.0;
        double target = params.getMean();
        double bias = target != 0.0 ? (mean - target) / target * 100.0 : 0.0;

        Double tea = params.getTotalAllowableErrorPercent();
        double sigma = 0.0;
        SigmaQuality quality = null;
        if (tea != null) {
            sigma = sigmaMetric(tea, bias, cv);
            quality = SigmaQuality.fromSigma(sigma);
        }

        return new QcStatistics(values.length, mean, sd, bias, cv, sigma, quality);
    }

    /**
     * @param teaPercent  total allowable error in percent
     * @param biasPercent bias in percent
     * @param cvPercent   coefficient of variation in percent
     * @return sigma metric, 0 when the CV is 0
     */
    public static double sigmaMetric(double teaPercent, double biasPercent, double cvPercent) {
        if (cvPercent == 0.0) {
            return 0.0;
        }
        return (teaPercent - Math.abs(biasPercent)) / cvPercent;
    }
}

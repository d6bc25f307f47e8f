/* (C)2026 */
package com.ammann.qc.service;

import com.ammann.qc.detection.SeriesSupport;
import com.ammann.qc.enumeration.StatisticalTest;
import com.ammann.qc.exception.ValidationException;
import com.ammann.qc.model.BlandAltmanResult;
import com.ammann.qc.model.CorrelationResult;
import com.ammann.qc.model.HypothesisTestResult;
import com.ammann.qc.model.MethodComparisonResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.inference.MannWhitneyUTest;
import org.apache.commons.math3.stat.inference.OneWayAnova;
import org.apache.commons.math3.stat.inference.TTest;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Compares two measurement methods run on the same samples.
 *
 * <p>Method A is the reference. Differences are always {@code a - b}, and the regression fits
 * B against A. Both series must have the same length and at least {@value #MIN_PAIRS} values.
 * Optional groups add a one-way ANOVA; it needs at least two groups of at least two values.
 */
@ApplicationScoped
public class MethodComparisonService {

    private static final Logger LOG = Logger.getLogger(MethodComparisonService.class);

    /** Minimum number of paired samples for a comparison. */
    public static final int MIN_PAIRS = 3;

    /** z-value of the 95% limits of agreement. */
    static final double Z_95 = 1.96;

    private final double significance;
    private final MeterRegistry meterRegistry;
    private final TTest tTest = new TTest();
    private final MannWhitneyUTest mannWhitney = new MannWhitneyUTest();
    private final OneWayAnova anova = new OneWayAnova();

    private Counter comparisonCounter;

    @Inject
    public MethodComparisonService(
            @ConfigProperty(name = "qc.comparison.significance", defaultValue = "0.05")
                    double significance,
            MeterRegistry meterRegistry) {
        if (!(significance > 0.0 && significance < 1.0)) {
            throw ValidationException.invalidParameter(
                    "qc.comparison.significance", significance, "value in (0, 1)");
        }
        this.significance = significance;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - comparison metrics disabled");
            return;
        }
        comparisonCounter =
                Counter.builder("qc_method_comparisons_total")
                        .description("Completed method comparisons")
                        .register(meterRegistry);
    }

    public double significance() {
        return significance;
    }

    /**
     * Runs agreement, correlation and significance tests on two methods.
     *
     * @param methodA reference method values
     * @param methodB candidate method values, paired by index with {@code methodA}
     * @param groups  optional named groups for a one-way ANOVA, may be null or empty
     * @return the full comparison
     * @throws ValidationException for unequal lengths, too few pairs, non-finite values or
     *     unusable groups
     */
    public MethodComparisonResult compare(
            List<Double> methodA, List<Double> methodB, Map<String, List<Double>> groups) {
        double[][] pair = pairs(methodA, methodB);
        double[] a = pair[0];
        double[] b = pair[1];

        BlandAltmanResult agreement = blandAltman(a, b);
        CorrelationResult correlation = correlation(a, b);
        List<HypothesisTestResult> tests = new ArrayList<>(tests(a, b));
        if (groups != null && !groups.isEmpty()) {
            tests.add(anova(groups));
        }

        if (comparisonCounter != null) {
            comparisonCounter.increment();
        }
        LOG.debugf(
                "Compared %d pairs: mean difference %.4f, Pearson r %.4f",
                Integer.valueOf(a.length),
                Double.valueOf(agreement.meanDifference()),
                Double.valueOf(correlation.pearsonR()));
        return new MethodComparisonResult(a.length, significance, agreement, correlation, tests);
    }

    /**
     * @param methodA reference method values
     * @param methodB candidate method values
     * @return Bland-Altman agreement of the two methods
     */
    public BlandAltmanResult blandAltman(List<Double> methodA, List<Double> methodB) {
        double[][] pair = pairs(methodA, methodB);
        return blandAltman(pair[0], pair[1]);
    }

    /**
     * @param methodA reference method values
     * @param methodB candidate method values
     * @return Pearson and Spearman correlation with the least-squares fit of B on A
     */
    public CorrelationResult correlation(List<Double> methodA, List<Double> methodB) {
        double[][] pair = pairs(methodA, methodB);
        return correlation(pair[0], pair[1]);
    }

    BlandAltmanResult blandAltman(double[] a, double[] b) {
        int n = a.length;
        DescriptiveStatistics differences = new DescriptiveStatistics();
        for (int i = 0; i < n; i++) {
            differences.addValue(a[i] - b[i]);
        }
        double mean = differences.getMean();
        double sd = differences.getStandardDeviation();
        double upper = mean + Z_95 * sd;
        double lower = mean - Z_95 * sd;

        int within = 0;
        for (double d : differences.getValues()) {
            if (d >= lower && d <= upper) {
                within++;
            }
        }
        // standard error of either limit is sd * sqrt(3 / n)
        double halfWidth = Z_95 * sd * Math.sqrt(3.0 / n);
        return new BlandAltmanResult(
                n, mean, sd, upper, lower, halfWidth, within * 100.0 / n);
    }

    CorrelationResult correlation(double[] a, double[] b) {
        double[][] data = new double[a.length][2];
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < a.length; i++) {
            data[i][0] = a[i];
            data[i][1] = b[i];
            regression.addData(a[i], b[i]);
        }

        PearsonsCorrelation pearson = new PearsonsCorrelation(data);
        double pearsonR = pearson.getCorrelationMatrix().getEntry(0, 1);
        double pearsonP = pearson.getCorrelationPValues().getEntry(0, 1);

        SpearmansCorrelation spearman = new SpearmansCorrelation(new Array2DRowRealMatrix(data));
        double spearmanR = spearman.getCorrelationMatrix().getEntry(0, 1);
        double spearmanP = spearman.getRankCorrelation().getCorrelationPValues().getEntry(0, 1);

        return new CorrelationResult(
                pearsonR,
                pearsonP,
                spearmanR,
                spearmanP,
                regression.getSlope(),
                regression.getIntercept(),
                regression.getRSquare());
    }

    List<HypothesisTestResult> tests(double[] a, double[] b) {
        return List.of(
                HypothesisTestResult.of(
                        StatisticalTest.PAIRED_T,
                        tTest.pairedT(a, b),
                        tTest.pairedTTest(a, b),
                        significance),
                HypothesisTestResult.of(
                        StatisticalTest.INDEPENDENT_T,
                        tTest.homoscedasticT(a, b),
                        tTest.homoscedasticTTest(a, b),
                        significance),
                HypothesisTestResult.of(
                        StatisticalTest.MANN_WHITNEY_U,
                        mannWhitney.mannWhitneyU(a, b),
                        mannWhitney.mannWhitneyUTest(a, b),
                        significance));
    }

    HypothesisTestResult anova(Map<String, List<Double>> groups) {
        if (groups.size() < 2) {
            throw ValidationException.insufficientData("ANOVA groups", 2, groups.size());
        }
        List<double[]> categories = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<Double>> group : groups.entrySet()) {
            double[] values = SeriesSupport.snapshot(group.getValue());
            if (values.length < 2) {
                throw ValidationException.invalidParameter(
                        "groups." + group.getKey(), values.length + " values", "at least 2");
            }
            categories.add(values);
        }
        return HypothesisTestResult.of(
                StatisticalTest.ONE_WAY_ANOVA,
                anova.anovaFValue(categories),
                anova.anovaPValue(categories),
                significance);
    }

    private static double[][] pairs(List<Double> methodA, List<Double> methodB) {
        double[] a = SeriesSupport.snapshot(methodA);
        double[] b = SeriesSupport.snapshot(methodB);
        if (a.length != b.length) {
            throw ValidationException.invalidParameter(
                    "methodB", b.length + " values", a.length + " values to pair with methodA");
        }
        if (a.length < MIN_PAIRS) {
            throw ValidationException.insufficientData("paired measurements", MIN_PAIRS, a.length);
        }
        return new double[][] {a, b};
    }
}

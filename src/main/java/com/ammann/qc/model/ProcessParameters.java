/* (C)2026 */
package com.ammann.qc.model;

import com.ammann.qc.enumeration.ControlZone;
import com.ammann.qc.enumeration.Sensitivity;
import com.ammann.qc.exception.ValidationException;
import java.util.Objects;

/**
 * Immutable description of a monitored measurement process: target mean and standard
 * deviation, sensitivity tier, and the constants of every detector.
 *
 * <p>Instances are created once per analyte and validated eagerly: {@link Builder#build()}
 * throws {@link ValidationException} for any parameter outside its domain instead of
 * clamping it. CUSUM {@code k}/{@code h} are expressed in standard-deviation units.
 */
public final class ProcessParameters {

    public static final double DEFAULT_CUSUM_K = 0.5;
    public static final double DEFAULT_CUSUM_H = 4.0;
    public static final double DEFAULT_EWMA_LAMBDA = 0.2;
    public static final double DEFAULT_EWMA_L = 2.7;
    public static final double DEFAULT_ANOMALY_THRESHOLD = 3.5;
    public static final double DEFAULT_ANOMALY_CRITICAL_THRESHOLD = 4.5;
    public static final int DEFAULT_TREND_WINDOW = 10;
    public static final double DEFAULT_TREND_SIGNIFICANCE = 0.05;
    public static final double DEFAULT_TREND_WARNING_CHANGE = 1.5;
    public static final double DEFAULT_TREND_CRITICAL_CHANGE = 2.5;
    public static final int DEFAULT_RUN_WINDOW = 7;
    public static final int DEFAULT_RUN_MINIMUM = 6;
    public static final int DEFAULT_ZIGZAG_WINDOW = 8;
    public static final int DEFAULT_ZIGZAG_MIN_REVERSALS = 6;

    private final double mean;
    private final double std;
    private final Sensitivity sensitivity;
    private final ThresholdMultipliers thresholds;
    private final double cusumK;
    private final double cusumH;
    private final double ewmaLambda;
    private final double ewmaL;
    private final double anomalyThreshold;
    private final double anomalyCriticalThreshold;
    private final int trendWindow;
    private final double trendSignificance;
    private final double trendWarningChange;
    private final double trendCriticalChange;
    private final int runWindow;
    private final int runMinimum;
    private final int zigzagWindow;
    private final int zigzagMinReversals;
    private final Double totalAllowableErrorPercent;
    private final SensitivityTable sensitivityTable;

    private ProcessParameters(Builder builder) {
        this.mean = builder.mean;
        this.std = builder.std;
        this.sensitivity = builder.sensitivity;
        this.thresholds = builder.sensitivityTable.resolve(builder.sensitivity);
        this.cusumK = builder.cusumK;
        this.cusumH = builder.cusumH;
        this.ewmaLambda = builder.ewmaLambda;
        this.ewmaL = builder.ewmaL;
        this.anomalyThreshold = builder.anomalyThreshold;
        this.anomalyCriticalThreshold = builder.anomalyCriticalThreshold;
        this.trendWindow = builder.trendWindow;
        this.trendSignificance = builder.trendSignificance;
        this.trendWarningChange = builder.trendWarningChange;
        this.trendCriticalChange = builder.trendCriticalChange;
        this.runWindow = builder.runWindow;
        this.runMinimum = builder.runMinimum;
        this.zigzagWindow = builder.zigzagWindow;
        this.zigzagMinReversals = builder.zigzagMinReversals;
        this.totalAllowableErrorPercent = builder.totalAllowableErrorPercent;
        this.sensitivityTable = builder.sensitivityTable;
    }

    /**
     * Starts a builder for a process with the given target mean and standard deviation.
     *
     * @param mean target mean
     * @param std  target standard deviation, must be positive
     * @return a builder preloaded with the default detector constants
     */
    public static Builder builder(double mean, double std) {
        return new Builder(mean, std);
    }

    /**
     * Shorthand for a process using medium sensitivity and all default constants.
     */
    public static ProcessParameters of(double mean, double std) {
        return builder(mean, std).build();
    }

    /**
     * Starts a builder for another target process that keeps every other constant of this one.
     *
     * @param mean target mean of the new process
     * @param std  target standard deviation of the new process
     */
    public Builder toBuilder(double mean, double std) {
        return new Builder(mean, std)
                .sensitivity(sensitivity, sensitivityTable)
                .cusum(cusumK, cusumH)
                .ewma(ewmaLambda, ewmaL)
                .anomalyThresholds(anomalyThreshold, anomalyCriticalThreshold)
                .trend(trendWindow, trendSignificance)
                .trendChange(trendWarningChange, trendCriticalChange)
                .runRule(runWindow, runMinimum)
                .zigzag(zigzagWindow, zigzagMinReversals)
                .totalAllowableErrorPercent(totalAllowableErrorPercent);
    }

    /**
     * @param value measured value
     * @return deviation of the value from the target mean in standard deviations
     */
    public double zScore(double value) {
        return (value - mean) / std;
    }

    /** Standard deviation of the EWMA statistic at steady state. */
    public double ewmaSigma() {
        return std * Math.sqrt(ewmaLambda / (2.0 - ewmaLambda));
    }

    public double ewmaUpperLimit() {
        return mean + ewmaL * ewmaSigma();
    }

    public double ewmaLowerLimit() {
        return mean - ewmaL * ewmaSigma();
    }

    /**
     * Classifies a single value against the sensitivity limits of this process.
     *
     * @param value measured value
     * @return the outermost zone whose limit the value exceeds
     */
    public ControlZone zoneOf(double value) {
        double distance = Math.abs(zScore(value));
        if (distance > thresholds.critical()) return ControlZone.CRITICAL;
        if (distance > thresholds.alert()) return ControlZone.ALERT;
        if (distance > thresholds.warning()) return ControlZone.WARNING;
        return ControlZone.WITHIN_LIMITS;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public Sensitivity getSensitivity() {
        return sensitivity;
    }

    public ThresholdMultipliers getThresholds() {
        return thresholds;
    }

    public double getCusumK() {
        return cusumK;
    }

    public double getCusumH() {
        return cusumH;
    }

    public double getEwmaLambda() {
        return ewmaLambda;
    }

    public double getEwmaL() {
        return ewmaL;
    }

    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public double getAnomalyCriticalThreshold() {
        return anomalyCriticalThreshold;
    }

    public int getTrendWindow() {
        return trendWindow;
    }

    public double getTrendSignificance() {
        return trendSignificance;
    }

    public double getTrendWarningChange() {
        return trendWarningChange;
    }

    public double getTrendCriticalChange() {
        return trendCriticalChange;
    }

    public int getRunWindow() {
        return runWindow;
    }

    public int getRunMinimum() {
        return runMinimum;
    }

    public int getZigzagWindow() {
        return zigzagWindow;
    }

    public int getZigzagMinReversals() {
        return zigzagMinReversals;
    }

    /**
     * @return total allowable error in percent, or {@code null} when not configured
     */
    public Double getTotalAllowableErrorPercent() {
        return totalAllowableErrorPercent;
    }

    @Override
    public String toString() {
        return String.format(
                "ProcessParameters{mean=%.4f, std=%.4f, sensitivity=%s, cusum(k=%.2f, h=%.2f),"
                        + " ewma(lambda=%.2f, L=%.2f), trendWindow=%d}",
                mean, std, sensitivity, cusumK, cusumH, ewmaLambda, ewmaL, trendWindow);
    }

    /**
     * Builder validating every constant on {@link #build()}.
     */
    public static final class Builder {
        private final double mean;
        private final double std;
        private Sensitivity sensitivity = Sensitivity.MEDIUM;
        private SensitivityTable sensitivityTable = SensitivityTable.defaults();
        private double cusumK = DEFAULT_CUSUM_K;
        private double cusumH = DEFAULT_CUSUM_H;
        private double ewmaLambda = DEFAULT_EWMA_LAMBDA;
        private double ewmaL = DEFAULT_EWMA_L;
        private double anomalyThreshold = DEFAULT_ANOMALY_THRESHOLD;
        private double anomalyCriticalThreshold = DEFAULT_ANOMALY_CRITICAL_THRESHOLD;
        private int trendWindow = DEFAULT_TREND_WINDOW;
        private double trendSignificance = DEFAULT_TREND_SIGNIFICANCE;
        private double trendWarningChange = DEFAULT_TREND_WARNING_CHANGE;
        private double trendCriticalChange = DEFAULT_TREND_CRITICAL_CHANGE;
        private int runWindow = DEFAULT_RUN_WINDOW;
        private int runMinimum = DEFAULT_RUN_MINIMUM;
        private int zigzagWindow = DEFAULT_ZIGZAG_WINDOW;
        private int zigzagMinReversals = DEFAULT_ZIGZAG_MIN_REVERSALS;
        private Double totalAllowableErrorPercent;

        private Builder(double mean, double std) {
            this.mean = mean;
            this.std = std;
        }

        public Builder sensitivity(Sensitivity sensitivity, SensitivityTable table) {
            this.sensitivity = Objects.requireNonNull(sensitivity, "sensitivity");
            this.sensitivityTable = Objects.requireNonNull(table, "table");
            return this;
        }

        public Builder sensitivity(Sensitivity sensitivity) {
            return sensitivity(sensitivity, sensitivityTable);
        }

        public Builder cusum(double k, double h) {
            this.cusumK = k;
            this.cusumH = h;
            return this;
        }

        public Builder ewma(double lambda, double controlLimitMultiplier) {
            this.ewmaLambda = lambda;
            this.ewmaL = controlLimitMultiplier;
            return this;
        }

        public Builder anomalyThresholds(double warning, double critical) {
            this.anomalyThreshold = warning;
            this.anomalyCriticalThreshold = critical;
            return this;
        }

        public Builder trend(int window, double significance) {
            this.trendWindow = window;
            this.trendSignificance = significance;
            return this;
        }

        public Builder trendChange(double warning, double critical) {
            this.trendWarningChange = warning;
            this.trendCriticalChange = critical;
            return this;
        }

        public Builder runRule(int window, int minimum) {
            this.runWindow = window;
            this.runMinimum = minimum;
            return this;
        }

        public Builder zigzag(int window, int minReversals) {
            this.zigzagWindow = window;
            this.zigzagMinReversals = minReversals;
            return this;
        }

        public Builder totalAllowableErrorPercent(Double teaPercent) {
            this.totalAllowableErrorPercent = teaPercent;
            return this;
        }

        /**
         * Validates all constants and creates the parameters.
         *
         * @return immutable process parameters
         * @throws ValidationException if any constant is outside its domain
         */
        public ProcessParameters build() {
            if (!Double.isFinite(mean)) {
                throw ValidationException.invalidParameter("mean", mean, "finite number");
            }
            if (!(std > 0) || !Double.isFinite(std)) {
                throw ValidationException.invalidParameter("std", std, "finite number > 0");
            }
            requirePositive("cusumK", cusumK);
            requirePositive("cusumH", cusumH);
            if (!(ewmaLambda > 0 && ewmaLambda <= 1)) {
                throw ValidationException.invalidParameter("ewmaLambda", ewmaLambda, "value in (0, 1]");
            }
            requirePositive("ewmaL", ewmaL);
            requirePositive("anomalyThreshold", anomalyThreshold);
            if (!(anomalyCriticalThreshold >= anomalyThreshold)) {
                throw ValidationException.invalidParameter(
                        "anomalyCriticalThreshold",
                        anomalyCriticalThreshold,
                        ">= anomalyThreshold (" + anomalyThreshold + ")");
            }
            if (trendWindow < 3) {
                throw ValidationException.invalidParameter("trendWindow", trendWindow, "integer >= 3");
            }
            if (!(trendSignificance > 0 && trendSignificance < 1)) {
                throw ValidationException.invalidParameter(
                        "trendSignificance", trendSignificance, "value in (0, 1)");
            }
            requirePositive("trendWarningChange", trendWarningChange);
            if (!(trendCriticalChange >= trendWarningChange)) {
                throw ValidationException.invalidParameter(
                        "trendCriticalChange",
                        trendCriticalChange,
                        ">= trendWarningChange (" + trendWarningChange + ")");
            }
            if (runWindow < 2 || runMinimum < 1 || runMinimum > runWindow) {
                throw ValidationException.invalidParameter(
                        "runRule", runMinimum + "/" + runWindow, "window >= 2 and 1 <= minimum <= window");
            }
            if (zigzagWindow < 3 || zigzagMinReversals < 1 || zigzagMinReversals > zigzagWindow - 2) {
                throw ValidationException.invalidParameter(
                        "zigzag",
                        zigzagMinReversals + "/" + zigzagWindow,
                        "window >= 3 and 1 <= reversals <= window - 2");
            }
            if (totalAllowableErrorPercent != null && !(totalAllowableErrorPercent > 0)) {
                throw ValidationException.invalidParameter(
                        "totalAllowableErrorPercent", totalAllowableErrorPercent, "positive percentage");
            }
            return new ProcessParameters(this);
        }

        private static void requirePositive(String name, double value) {
            if (!(value > 0) || !Double.isFinite(value)) {
                throw ValidationException.invalidParameter(name, value, "finite number > 0");
            }
        }
    }
}

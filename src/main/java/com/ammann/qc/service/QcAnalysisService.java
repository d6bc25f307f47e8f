/* (C)2026 */
package com.ammann.qc.service;

import com.ammann.qc.detection.CusumDetector;
import com.ammann.qc.detection.EwmaDetector;
import com.ammann.qc.detection.RobustAnomalyDetector;
import com.ammann.qc.detection.RunPatternDetector;
import com.ammann.qc.detection.SeriesSupport;
import com.ammann.qc.detection.TrendDetector;
import com.ammann.qc.detection.ViolationAggregator;
import com.ammann.qc.detection.WestgardRuleEvaluator;
import com.ammann.qc.enumeration.AnalysisStatus;
import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.exception.ValidationException;
import com.ammann.qc.model.AnalysisReport;
import com.ammann.qc.model.CusumResult;
import com.ammann.qc.model.EwmaResult;
import com.ammann.qc.model.MergedReport;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.QcStatistics;
import com.ammann.qc.model.Violation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Batch analysis of a complete QC series.
 *
 * <p>Runs the six detectors in a fixed order (Westgard, CUSUM, EWMA, robust anomaly, trend,
 * run patterns), merges their findings and computes the descriptive statistics. A series no
 * longer than the trend window has too little history for a trend fit; the trend detector is
 * then skipped instead of failing the analysis.
 */
@ApplicationScoped
public class QcAnalysisService {

    private static final Logger LOG = Logger.getLogger(QcAnalysisService.class);

    private final WestgardRuleEvaluator westgard;
    private final CusumDetector cusum;
    private final EwmaDetector ewma;
    private final RobustAnomalyDetector anomaly;
    private final TrendDetector trend;
    private final RunPatternDetector runPatterns;
    private final ViolationAggregator aggregator;
    private final QcStatisticsService statistics;
    private final ReportDispatcher dispatcher;
    private final MeterRegistry meterRegistry;

    private Counter analysisCounter;
    private Timer analysisTimer;
    private final Map<Severity, Counter> violationCounters = new EnumMap<>(Severity.class);

    @Inject
    public QcAnalysisService(
            WestgardRuleEvaluator westgard,
            CusumDetector cusum,
            EwmaDetector ewma,
            RobustAnomalyDetector anomaly,
            TrendDetector trend,
            RunPatternDetector runPatterns,
            ViolationAggregator aggregator,
            QcStatisticsService statistics,
            ReportDispatcher dispatcher,
            MeterRegistry meterRegistry) {
        this.westgard = westgard;
        this.cusum = cusum;
        this.ewma = ewma;
        this.anomaly = anomaly;
        this.trend = trend;
        this.runPatterns = runPatterns;
        this.aggregator = aggregator;
        this.statistics = statistics;
        this.dispatcher = dispatcher;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - analysis metrics disabled");
            return;
        }
        analysisCounter =
                Counter.builder("qc_analyses_total")
                        .description("Completed batch analyses")
                        .register(meterRegistry);
        analysisTimer =
                Timer.builder("qc_analysis_duration")
                        .description("Duration of a batch analysis")
                        .register(meterRegistry);
        for (Severity severity : Severity.values()) {
            violationCounters.put(
                    severity,
                    Counter.builder("qc_violations_total")
                            .description("Violations reported by batch analyses")
                            .tag("severity", severity.name())
                            .register(meterRegistry));
        }
    }

    /**
     * Runs all detectors and merges their findings.
     *
     * @param series ordered measurements
     * @param params process parameters
     * @return merged report
     * @throws ValidationException for an empty series or non-finite values
     */
    public MergedReport evaluateBatch(List<Double> series, ProcessParameters params) {
        return evaluate(series, params).merged();
    }

    /**
     * Runs a full analysis and hands the result to the registered report sinks.
     *
     * @param label  analyte name or other label for logs and sinks
     * @param series ordered measurements
     * @param params process parameters
     * @return report with detector series, statistics and terminal status
     */
    public AnalysisReport analyze(String label, List<Double> series, ProcessParameters params) {
        long start = System.nanoTime();
        AnalysisReport report = evaluate(series, params);
        recordMetrics(report, System.nanoTime() - start);

        LOG.infof(
                "Analysis '%s' of %d points finished: %s",
                label, series.size(), report.merged().summary().message());

        DeliveryResult delivery = dispatcher.dispatch(label, report);
        if (!delivery.isComplete()) {
            LOG.warnf(
                    "Report '%s' reached %d of %d sinks; failed: %s",
                    label, delivery.delivered(), delivery.attempted(), delivery.failedSinks());
        }
        return report;
    }

    AnalysisReport evaluate(List<Double> series, ProcessParameters params) {
        Objects.requireNonNull(params, "params");
        List<Double> values = toList(SeriesSupport.snapshot(series));

        AnalysisStatus status = AnalysisStatus.PENDING.advanceTo(AnalysisStatus.EVALUATING);

        List<Violation> westgardFindings = westgard.detect(values, params);
        CusumResult cusumResult = cusum.detect(values, params);
        EwmaResult ewmaResult = ewma.detect(values, params);
        List<Violation> anomalies = anomaly.detect(values, params);
        List<Violation> trends;
        if (params.getTrendWindow() < values.size()) {
            trends = trend.detect(values, params);
        } else {
            LOG.debugf(
                    "Trend detection skipped: window %d needs more than %d points",
                    params.getTrendWindow(), values.size());
            trends = List.of();
        }
        List<Violation> runs = runPatterns.detect(values, params);

        MergedReport merged =
                aggregator.merge(
                        List.of(
                                westgardFindings,
                                cusumResult.violations(),
                                ewmaResult.violations(),
                                anomalies,
                                trends,
                                runs));
        status = status.advanceTo(AnalysisStatus.MERGED);

        QcStatistics stats = statistics.calculate(values, params);
        status = status.advanceTo(AnalysisStatus.terminalFor(merged.disposition()));

        return new AnalysisReport(merged, cusumResult, ewmaResult, stats, status);
    }

    private void recordMetrics(AnalysisReport report, long elapsedNanos) {
        if (analysisCounter == null) {
            return;
        }
        analysisCounter.increment();
        analysisTimer.record(Duration.ofNanos(elapsedNanos));
        for (Violation violation : report.merged().violations()) {
            violationCounters.get(violation.severity()).increment();
        }
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return List.copyOf(list);
    }
}

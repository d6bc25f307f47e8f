/* (C)2026 */
package com.ammann.qc.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view of the {@code qc.*} configuration tree in application.properties.
 *
 * <p>Example:
 * <pre>
 * qc.analytes.creatinine.mean=1.0
 * qc.analytes.creatinine.std=0.05
 * qc.analytes.creatinine.tea-percent=15
 * qc.sensitivity.high.warning=1.5
 * qc.monitor.tick-interval=2s
 * </pre>
 */
@ConfigMapping(prefix = "qc")
public interface QcConfig {

    /** Monitored analytes keyed by name. */
    Map<String, Analyte> analytes();

    /** Threshold multipliers per sensitivity tier, keyed by tier label. */
    Map<String, Tier> sensitivity();

    Detection detection();

    Monitor monitor();

    Report report();

    Comparison comparison();

    interface Analyte {
        double mean();

        double std();

        /** Total allowable error in percent; enables the sigma metric. */
        Optional<Double> teaPercent();

        @WithDefault("medium")
        String sensitivity();

        /** Unit label shown to collaborators, e.g. {@code mg/dL}. */
        Optional<String> unit();
    }

    interface Tier {
        double warning();

        double alert();

        double critical();
    }

    /** Detector constants applied to every configured analyte. */
    interface Detection {
        @WithDefault("0.5")
        double cusumK();

        @WithDefault("4.0")
        double cusumH();

        @WithDefault("0.2")
        double ewmaLambda();

        @WithDefault("2.7")
        double ewmaL();

        @WithDefault("3.5")
        double anomalyThreshold();

        @WithDefault("4.5")
        double anomalyCriticalThreshold();

        @WithDefault("10")
        int trendWindow();

        @WithDefault("0.05")
        double trendSignificance();

        @WithDefault("7")
        int runWindow();

        @WithDefault("6")
        int runMinimum();

        @WithDefault("8")
        int zigzagWindow();

        @WithDefault("6")
        int zigzagMinReversals();
    }

    interface Monitor {
        @WithDefault("true")
        boolean enabled();

        @WithDefault("2s")
        Duration tickInterval();

        /** Maximum number of trailing points kept per analyte. */
        @WithDefault("100")
        int bufferSize();

        /** Maximum number of violations kept in each analyte's log. */
        @WithDefault("50")
        int violationLogSize();

        /** Also evaluate 4-1s, 10-x, 7-T, 6-x and 8-x on the trailing buffer. */
        @WithDefault("false")
        boolean extendedRules();

        /** Maximum number of queued measurements per analyte. */
        @WithDefault("1000")
        int queueCapacity();
    }

    interface Comparison {
        /** p-value below which a method-comparison test counts as significant. */
        @WithDefault("0.05")
        double significance();
    }

    interface Report {
        /** Log the summary of every batch report. */
        @WithDefault("true")
        boolean logEnabled();
    }
}

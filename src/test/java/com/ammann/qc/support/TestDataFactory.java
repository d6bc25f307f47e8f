/* (C)2026 */
package com.ammann.qc.support;

import com.ammann.qc.model.ProcessParameters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public final class TestDataFactory {

    public static final double MEAN = 1.0;
    public static final double STD = 0.05;

    private TestDataFactory() {}

    /** Creatinine-like process: mean 1.0, std 0.05, medium sensitivity. */
    public static ProcessParameters creatinine() {
        return ProcessParameters.of(MEAN, STD);
    }

    /** Standard normal process, convenient for z-score arithmetic. */
    public static ProcessParameters unit() {
        return ProcessParameters.of(0.0, 1.0);
    }

    public static List<Double> flat(int count, double value) {
        return new ArrayList<>(Collections.nCopies(count, value));
    }

    /** Flat series at the process mean with one value replaced. */
    public static List<Double> flatWithSpike(
            ProcessParameters params, int count, int spikeIndex, double spikeInSd) {
        List<Double> series = flat(count, params.getMean());
        series.set(spikeIndex, params.getMean() + spikeInSd * params.getStd());
        return series;
    }

    /** Values expressed in SD units around the process mean. */
    public static List<Double> inSd(ProcessParameters params, double... zScores) {
        List<Double> series = new ArrayList<>(zScores.length);
        for (double z : zScores) {
            series.add(params.getMean() + z * params.getStd());
        }
        return series;
    }

    /** Linear ramp starting at the mean, rising by {@code stepInSd} SD per point. */
    public static List<Double> ramp(ProcessParameters params, int count, double stepInSd) {
        List<Double> series = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            series.add(params.getMean() + i * stepInSd * params.getStd());
        }
        return series;
    }

    /** Alternates {@code mean, mean+delta, mean-delta, mean+delta, ...}. */
    public static List<Double> alternating(ProcessParameters params, int count, double deltaInSd) {
        List<Double> series = new ArrayList<>(count);
        series.add(params.getMean());
        for (int i = 1; i < count; i++) {
            double sign = i % 2 == 1 ? 1.0 : -1.0;
            series.add(params.getMean() + sign * deltaInSd * params.getStd());
        }
        return series;
    }

    /** Deterministic pseudo-noise within ±amplitude SD, reproducible across runs. */
    public static List<Double> noisy(ProcessParameters params, int count, double amplitudeInSd, long seed) {
        Random random = new Random(seed);
        List<Double> series = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double z = (random.nextDouble() * 2.0 - 1.0) * amplitudeInSd;
            series.add(params.getMean() + z * params.getStd());
        }
        return series;
    }
}

/* (C)2026 */
package com.ammann.qc.service;

import com.ammann.qc.enumeration.ControlZone;
import com.ammann.qc.model.Measurement;
import com.ammann.qc.model.QcStatistics;
import com.ammann.qc.model.Violation;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable view of one monitored analyte, published after every processed point.
 *
 * @param analyte       analyte name
 * @param pointCount    points processed since the monitor started
 * @param trailing      trailing values, oldest first
 * @param latestValue   last processed value, {@code null} before the first point
 * @param latestZone    control zone of the last value, {@code null} before the first point
 * @param violationLog  most recent violations, oldest first
 * @param statistics    statistics of the trailing values
 * @param cusumPositive current upper CUSUM
 * @param cusumNegative current lower CUSUM
 * @param ewma          current EWMA, {@code null} before the first point
 * @param updatedAt     when the snapshot was published, {@code null} before the first point
 */
public record MonitorSnapshot(
        String analyte,
        int pointCount,
        List<Double> trailing,
        Double latestValue,
        ControlZone latestZone,
        List<Violation> violationLog,
        QcStatistics statistics,
        double cusumPositive,
        double cusumNegative,
        Double ewma,
        Instant updatedAt) {

    public MonitorSnapshot {
        trailing = List.copyOf(trailing);
        violationLog = List.copyOf(violationLog);
    }

    /** Trailing values with their series positions, oldest first. */
    public List<Measurement> trailingMeasurements() {
        int first = pointCount - trailing.size();
        List<Measurement> measurements = new ArrayList<>(trailing.size());
        for (int i = 0; i < trailing.size(); i++) {
            measurements.add(new Measurement(first + i, trailing.get(i)));
        }
        return List.copyOf(measurements);
    }

    static MonitorSnapshot empty(String analyte) {
        return new MonitorSnapshot(
                analyte, 0, List.of(), null, null, List.of(), QcStatistics.empty(0), 0.0, 0.0, null, null);
    }
}

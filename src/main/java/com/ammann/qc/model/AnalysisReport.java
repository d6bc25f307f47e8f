/* (C)2026 */
package com.ammann.qc.model;

import com.ammann.qc.enumeration.AnalysisStatus;

/**
 * Everything a batch analysis produces: the merged report, the detector series that
 * charting consumers draw, and the descriptive statistics.
 *
 * @param merged     merged violation report
 * @param cusum      CUSUM accumulators and violations
 * @param ewma       EWMA series, limits and violations
 * @param statistics descriptive statistics of the series
 * @param status     terminal status of the run
 */
public record AnalysisReport(
        MergedReport merged,
        CusumResult cusum,
        EwmaResult ewma,
        QcStatistics statistics,
        AnalysisStatus status) {}

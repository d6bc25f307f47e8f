/* (C)2026 */
package com.ammann.qc.service;

import com.ammann.qc.exception.ReportDeliveryException;
import com.ammann.qc.model.AnalysisReport;

/**
 * Receiver of finished batch reports, discovered as CDI beans.
 *
 * <p>Implementations must not modify the report. A failing sink signals with
 * {@link ReportDeliveryException}; {@link ReportDispatcher} keeps the failure away from the
 * analysis and from other sinks.
 */
public interface ReportSink {

    /** Name used in logs and in {@link DeliveryResult#failedSinks()}. */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * @param label  analyte name or other label of the analysed series
     * @param report finished report
     */
    void deliver(String label, AnalysisReport report);
}

/* (C)2026 */
package com.ammann.qc.service;

import com.ammann.qc.model.AnalysisReport;
import com.ammann.qc.model.Summary;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/** Writes the summary line of every finished report to the application log. */
@ApplicationScoped
public class LoggingReportSink implements ReportSink {

    private static final Logger LOG = Logger.getLogger(LoggingReportSink.class);

    @ConfigProperty(name = "qc.report.log-enabled", defaultValue = "true")
    boolean enabled = true;

    @Override
    public void deliver(String label, AnalysisReport report) {
        if (!enabled) {
            return;
        }
        Summary summary = report.merged().summary();
        LOG.infof(
                "QC report [%s]: %s (status=%s, violations=%d)",
                label, summary.message(), report.status(), summary.totalViolations());
    }
}

/* (C)2026 */
package com.ammann.qc.detection;

import com.ammann.qc.enumeration.DetectionMethod;
import com.ammann.qc.enumeration.Disposition;
import com.ammann.qc.enumeration.Severity;
import com.ammann.qc.model.MergedReport;
import com.ammann.qc.model.Summary;
import com.ammann.qc.model.Violation;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Merges the outputs of all detectors into one chronological report.
 *
 * <p>Outputs are concatenated in the order given and stable-sorted by index, so violations at
 * the same index keep detector emission order. No detection logic happens here.
 */
@ApplicationScoped
public class ViolationAggregator {

    private static final Logger LOG = Logger.getLogger(ViolationAggregator.class);

    /**
     * @param detectorOutputs violations of each detector, in detector order
     * @return merged, index-ordered report with summary
     */
    public MergedReport merge(List<List<Violation>> detectorOutputs) {
        List<Violation> merged = new ArrayList<>();
        for (List<Violation> output : detectorOutputs) {
            merged.addAll(output);
        }
        merged.sort(Comparator.comparingInt(Violation::index));

        Summary summary = summarize(merged);
        LOG.debugf(
                "Merged %d violations from %d detectors: %s",
                merged.size(), detectorOutputs.size(), summary.disposition());
        return new MergedReport(merged, summary);
    }

    /**
     * Computes counts and verdict for an already merged list.
     *
     * @param violations merged violations
     * @return summary
     */
    public Summary summarize(List<Violation> violations) {
        Map<DetectionMethod, Integer> byMethod = new EnumMap<>(DetectionMethod.class);
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        int critical = 0;
        int warning = 0;

        for (Violation violation : violations) {
            byMethod.merge(violation.method(), 1, Integer::sum);
            bySeverity.merge(violation.severity(), 1, Integer::sum);
            if (violation.isCritical()) {
                critical++;
            } else {
                warning++;
            }
        }

        Disposition disposition = Disposition.fromCounts(critical, warning);
        return new Summary(
                violations.size(),
                critical,
                warning,
                byMethod,
                bySeverity,
                disposition,
                message(disposition, critical, warning));
    }

    private static String message(Disposition disposition, int critical, int warning) {
        return switch (disposition) {
            case IN_CONTROL -> "No violations detected - QC is in control";
            case NEEDS_REVIEW -> String.format("WARNING: %d warnings - investigate", warning);
            case REJECT -> String.format(
                    "CRITICAL: %d critical violations (%d warnings) - reject run",
                    critical, warning);
        };
    }
}

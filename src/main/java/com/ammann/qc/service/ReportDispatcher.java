/* (C)2026 */
package com.ammann.qc.service;

import com.ammann.qc.exception.ReportDeliveryException;
import com.ammann.qc.model.AnalysisReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Hands finished reports to every {@link ReportSink}.
 *
 * <p>Sinks are called one after another. A sink that throws is logged and recorded in the
 * {@link DeliveryResult}; the remaining sinks still receive the report.
 */
@ApplicationScoped
public class ReportDispatcher {

    private static final Logger LOG = Logger.getLogger(ReportDispatcher.class);

    private final List<ReportSink> sinks;
    private final MeterRegistry meterRegistry;

    private Counter deliveryFailureCounter;

    @Inject
    public ReportDispatcher(Instance<ReportSink> sinkInstances, MeterRegistry meterRegistry) {
        this(sinkInstances.stream().toList(), meterRegistry);
    }

    ReportDispatcher(List<ReportSink> sinks, MeterRegistry meterRegistry) {
        this.sinks = List.copyOf(sinks);
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - report delivery metrics disabled");
            return;
        }
        deliveryFailureCounter =
                Counter.builder("qc_report_delivery_failures_total")
                        .description("Report deliveries rejected by a sink")
                        .register(meterRegistry);
    }

    /**
     * @param label  label of the analysed series
     * @param report finished report, passed unchanged to every sink
     * @return which sinks failed
     */
    public DeliveryResult dispatch(String label, AnalysisReport report) {
        if (sinks.isEmpty()) {
            return DeliveryResult.none();
        }

        List<String> failed = new ArrayList<>();
        for (ReportSink sink : sinks) {
            try {
                sink.deliver(label, report);
            } catch (ReportDeliveryException e) {
                LOG.warnf("Report sink %s rejected report for '%s': %s", sink.name(), label, e.getMessage());
                recordFailure(failed, sink);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Report sink %s failed for '%s'", sink.name(), label);
                recordFailure(failed, sink);
            }
        }
        return new DeliveryResult(sinks.size(), failed);
    }

    private void recordFailure(List<String> failed, ReportSink sink) {
        failed.add(sink.name());
        if (deliveryFailureCounter != null) {
            deliveryFailureCounter.increment();
        }
    }
}

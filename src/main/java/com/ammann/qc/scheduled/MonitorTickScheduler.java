/* (C)2026 */
package com.ammann.qc.scheduled;

import com.ammann.qc.service.QcMonitorService;
import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.Scheduled.ConcurrentExecution;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Drives the real-time monitor.
 * <p>
 * Every {@code qc.monitor.tick-interval} the monitor takes one pending measurement per
 * analyte. Overlapping runs are skipped so a slow tick never runs twice.
 */
@ApplicationScoped
public class MonitorTickScheduler {

    private static final Logger LOG = Logger.getLogger(MonitorTickScheduler.class);

    @Inject QcMonitorService monitor;

    @Scheduled(
            every = "${qc.monitor.tick-interval}",
            identity = "qc-monitor-tick",
            concurrentExecution = ConcurrentExecution.SKIP)
    public void tick() {
        int processed = monitor.tick();
        if (processed > 0) {
            LOG.debugf("Monitor tick processed %d measurements", processed);
        }
    }
}

/* (C)2026 */
package com.ammann.qc.health;

import com.ammann.qc.service.QcMonitorService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness check for the real-time QC monitor.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: monitor stopped on purpose, not ticked yet, or ticked recently</li>
 *   <li>DOWN: monitor running but no tick for more than five tick intervals</li>
 * </ul>
 */
@Liveness
@ApplicationScoped
public class MonitorHealthCheck implements HealthCheck {

    static final int STALE_TICKS = 5;

    @Inject QcMonitorService monitor;

    @ConfigProperty(name = "qc.monitor.tick-interval", defaultValue = "2s")
    Duration tickInterval = Duration.ofSeconds(2);

    Clock clock = Clock.systemUTC();

    @Override
    public HealthCheckResponse call() {
        boolean running = monitor.isRunning();
        Instant lastTick = monitor.getLastTick();

        String status;
        boolean up;
        if (!running) {
            status = "STOPPED";
            up = true;
        } else if (lastTick == null) {
            status = "STARTING";
            up = true;
        } else {
            Duration sinceLastTick = Duration.between(lastTick, clock.instant());
            up = sinceLastTick.compareTo(tickInterval.multipliedBy(STALE_TICKS)) <= 0;
            status = up ? "TICKING" : "STALLED";
        }

        HealthCheckResponseBuilder builder =
                HealthCheckResponse.named("qc-monitor")
                        .status(up)
                        .withData("running", running)
                        .withData("analytes", monitor.analytes().size())
                        .withData("status", status);
        if (lastTick != null) {
            builder.withData("last-tick", lastTick.toString());
        }
        return builder.build();
    }
}

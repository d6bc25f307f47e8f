/* (C)2026 */
package com.ammann.qc.service;

import com.ammann.qc.config.AnalyteRegistry;
import com.ammann.qc.exception.ValidationException;
import com.ammann.qc.model.IncrementalResult;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.StreamingState;
import com.ammann.qc.model.Violation;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Real-time QC monitor with one channel per configured analyte.
 *
 * <p>Each {@link #tick()} takes at most one pending measurement per analyte from the
 * {@link MeasurementSource} and evaluates it incrementally. Streaming state is only touched by
 * the ticking thread; readers get the latest {@link MonitorSnapshot} through an
 * {@link AtomicReference} and never block a tick.
 *
 * <p>{@link #stop()} and {@link #start()} are cooperative: a tick already running completes,
 * later ticks are skipped until the monitor is started again. State is kept across a stop.
 */
@ApplicationScoped
public class QcMonitorService {

    private static final Logger LOG = Logger.getLogger(QcMonitorService.class);

    private final IncrementalEvaluator evaluator;
    private final QcStatisticsService statistics;
    private final MeasurementSource source;
    private final int violationLogSize;
    private final Clock clock;
    private final Map<String, Channel> channels;

    private volatile boolean running;
    private volatile Instant lastTick;

    @Inject
    public QcMonitorService(
            AnalyteRegistry registry,
            IncrementalEvaluator evaluator,
            QcStatisticsService statistics,
            MeasurementSource source,
            @ConfigProperty(name = "qc.monitor.buffer-size", defaultValue = "100") int bufferSize,
            @ConfigProperty(name = "qc.monitor.violation-log-size", defaultValue = "50")
                    int violationLogSize,
            @ConfigProperty(name = "qc.monitor.enabled", defaultValue = "true") boolean enabled) {
        this(registry, evaluator, statistics, source, bufferSize, violationLogSize, enabled, Clock.systemUTC());
    }

    QcMonitorService(
            AnalyteRegistry registry,
            IncrementalEvaluator evaluator,
            QcStatisticsService statistics,
            MeasurementSource source,
            int bufferSize,
            int violationLogSize,
            boolean enabled,
            Clock clock) {
        if (bufferSize < evaluator.requiredBufferSize()) {
            throw ValidationException.invalidParameter(
                    "qc.monitor.buffer-size",
                    bufferSize,
                    "at least " + evaluator.requiredBufferSize() + " for rules " + evaluator.getRules());
        }
        if (violationLogSize < 1) {
            throw ValidationException.invalidParameter(
                    "qc.monitor.violation-log-size", violationLogSize, "positive integer");
        }
        this.evaluator = evaluator;
        this.statistics = statistics;
        this.source = source;
        this.violationLogSize = violationLogSize;
        this.clock = clock;
        this.running = enabled;

        Map<String, Channel> byName = new LinkedHashMap<>();
        registry.all().forEach((name, params) -> byName.put(name, new Channel(name, params, bufferSize)));
        this.channels = Collections.unmodifiableMap(byName);
        LOG.infof(
                "QC monitor prepared for %s (buffer=%d, log=%d, running=%s)",
                channels.keySet(), bufferSize, violationLogSize, enabled);
    }

    /**
     * Processes at most one pending measurement per analyte.
     *
     * @return number of measurements processed, 0 when stopped
     */
    public synchronized int tick() {
        if (!running) {
            return 0;
        }
        int processed = 0;
        for (Channel channel : channels.values()) {
            OptionalDouble next = source.poll(channel.name);
            if (next.isPresent()) {
                process(channel, next.getAsDouble());
                processed++;
            }
        }
        lastTick = clock.instant();
        return processed;
    }

    private void process(Channel channel, double value) {
        IncrementalResult result = evaluator.evaluateIncremental(value, channel.state, channel.params);
        channel.state = result.state();

        for (Violation violation : result.violations()) {
            if (channel.log.size() == violationLogSize) {
                channel.log.removeFirst();
            }
            channel.log.addLast(violation);
            LOG.infof(
                    "[%s] point %d: %s %s - %s",
                    channel.name,
                    violation.index(),
                    violation.severity(),
                    violation.source(),
                    violation.description());
        }

        StreamingState state = channel.state;
        channel.snapshot.set(
                new MonitorSnapshot(
                        channel.name,
                        state.nextIndex(),
                        state.trailing(),
                        value,
                        channel.params.zoneOf(value),
                        new ArrayList<>(channel.log),
                        statistics.calculate(state.trailing(), channel.params),
                        state.cusum().positive(),
                        state.cusum().negative(),
                        state.ewma().value(),
                        clock.instant()));
    }

    /**
     * @param analyte analyte name
     * @return latest snapshot, or empty if the analyte is not monitored
     */
    public Optional<MonitorSnapshot> snapshot(String analyte) {
        Channel channel = analyte == null ? null : channels.get(analyte);
        return channel == null ? Optional.empty() : Optional.of(channel.snapshot.get());
    }

    public Set<String> analytes() {
        return channels.keySet();
    }

    public boolean isMonitored(String analyte) {
        return analyte != null && channels.containsKey(analyte);
    }

    public void stop() {
        if (running) {
            running = false;
            LOG.info("QC monitor stopped");
        }
    }

    public void start() {
        if (!running) {
            running = true;
            LOG.info("QC monitor started");
        }
    }

    public boolean isRunning() {
        return running;
    }

    /** Time of the last completed tick, {@code null} if none ran yet. */
    public Instant getLastTick() {
        return lastTick;
    }

    private static final class Channel {
        private final String name;
        private final ProcessParameters params;
        private final Deque<Violation> log = new ArrayDeque<>();
        private final AtomicReference<MonitorSnapshot> snapshot;
        private StreamingState state;

        private Channel(String name, ProcessParameters params, int bufferSize) {
            this.name = name;
            this.params = params;
            this.state = StreamingState.initial(bufferSize);
            this.snapshot = new AtomicReference<>(MonitorSnapshot.empty(name));
        }
    }
}

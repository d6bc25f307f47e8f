/* (C)2026 */
package com.ammann.qc.service;

import com.ammann.qc.exception.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * In-memory measurement feed, one bounded FIFO queue per analyte.
 *
 * <p>Submitters never block: {@link #offer(String, double)} returns {@code false} when the
 * analyte's queue is full.
 */
@ApplicationScoped
public class QueuedMeasurementSource implements MeasurementSource {

    private static final Logger LOG = Logger.getLogger(QueuedMeasurementSource.class);

    private final int capacity;
    private final Map<String, BlockingQueue<Double>> queues = new ConcurrentHashMap<>();

    @Inject
    public QueuedMeasurementSource(
            @ConfigProperty(name = "qc.monitor.queue-capacity", defaultValue = "1000") int capacity) {
        if (capacity < 1) {
            throw ValidationException.invalidParameter("qc.monitor.queue-capacity", capacity, "positive integer");
        }
        this.capacity = capacity;
    }

    /**
     * Queues a measurement for the next ticks.
     *
     * @param analyte analyte name
     * @param value   measured value
     * @return whether the value was accepted
     * @throws ValidationException if the value is not finite
     */
    public boolean offer(String analyte, double value) {
        if (!Double.isFinite(value)) {
            throw ValidationException.invalidParameter("value", value, "finite number");
        }
        boolean accepted =
                queues.computeIfAbsent(analyte, k -> new LinkedBlockingQueue<>(capacity)).offer(value);
        if (!accepted) {
            LOG.warnf("Measurement queue for '%s' is full (%d); value %.4f dropped", analyte, capacity, value);
        }
        return accepted;
    }

    @Override
    public OptionalDouble poll(String analyte) {
        BlockingQueue<Double> queue = queues.get(analyte);
        if (queue == null) {
            return OptionalDouble.empty();
        }
        Double value = queue.poll();
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /** Number of measurements waiting for the given analyte. */
    public int pending(String analyte) {
        BlockingQueue<Double> queue = queues.get(analyte);
        return queue == null ? 0 : queue.size();
    }
}

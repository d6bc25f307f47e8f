/* (C)2026 */
package com.ammann.qc.service;

import java.util.List;

/**
 * Outcome of handing one report to all registered sinks.
 *
 * @param attempted   number of sinks the report was offered to
 * @param failedSinks names of sinks that failed, in dispatch order
 */
public record DeliveryResult(int attempted, List<String> failedSinks) {

    public DeliveryResult {
        failedSinks = List.copyOf(failedSinks);
    }

    public static DeliveryResult none() {
        return new DeliveryResult(0, List.of());
    }

    public boolean isComplete() {
        return failedSinks.isEmpty();
    }

    public int delivered() {
        return attempted - failedSinks.size();
    }
}

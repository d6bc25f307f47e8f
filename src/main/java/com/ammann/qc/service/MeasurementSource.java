/* (C)2026 */
package com.ammann.qc.service;

import java.util.OptionalDouble;

/**
 * Producer side of the real-time monitor. Polled once per analyte on every monitor tick.
 */
public interface MeasurementSource {

    /**
     * Takes the next pending measurement without blocking.
     *
     * @param analyte analyte name
     * @return next value, or empty if none is pending
     */
    OptionalDouble poll(String analyte);
}

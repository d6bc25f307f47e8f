/* (C)2026 */
package com.ammann.qc.model;

/**
 * One recorded observation and its 0-based position in the series.
 *
 * @param index position in the series
 * @param value observed value
 */
public record Measurement(int index, double value) {}

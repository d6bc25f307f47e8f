/* (C)2026 */
package com.ammann.qc.enumeration;

import java.util.Locale;

/**
 * Sensitivity tier of a monitored process.
 *
 * <p>Each tier selects a set of warning/alert/critical multipliers from a
 * {@link com.ammann.qc.model.SensitivityTable}. The tier itself carries no numbers.
 */
public enum Sensitivity {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Parses a tier label such as {@code "high"} or {@code "MEDIUM"}.
     *
     * @param label tier label, case-insensitive
     * @return the matching tier
     * @throws IllegalArgumentException if the label is blank or unknown
     */
    public static Sensitivity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Sensitivity label must not be blank");
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}

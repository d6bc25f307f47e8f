/* (C)2026 */
package com.ammann.qc.enumeration;

/**
 * Band a single measurement falls into relative to the sensitivity limits of its process.
 */
public enum ControlZone {
    /** Inside the warning limit. */
    WITHIN_LIMITS,
    /** Beyond the warning limit. */
    WARNING,
    /** Beyond the alert limit. */
    ALERT,
    /** Beyond the critical limit. */
    CRITICAL
}

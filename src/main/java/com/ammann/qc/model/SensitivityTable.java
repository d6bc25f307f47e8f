/* (C)2026 */
package com.ammann.qc.model;

import com.ammann.qc.enumeration.Sensitivity;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable lookup table from sensitivity tier to threshold multipliers.
 *
 * <p>Built once at configuration time and handed to {@link ProcessParameters.Builder}; there is
 * no shared mutable default.
 */
public final class SensitivityTable {

    private final Map<Sensitivity, ThresholdMultipliers> multipliers;

    private SensitivityTable(Map<Sensitivity, ThresholdMultipliers> multipliers) {
        this.multipliers = Collections.unmodifiableMap(new EnumMap<>(multipliers));
    }

    /**
     * Table with the standard laboratory presets: high 1.5/2.0/2.5, medium 2.0/2.5/3.0,
     * low 2.5/3.0/3.5.
     */
    public static SensitivityTable defaults() {
        Map<Sensitivity, ThresholdMultipliers> presets = new EnumMap<>(Sensitivity.class);
        presets.put(Sensitivity.HIGH, new ThresholdMultipliers(1.5, 2.0, 2.5));
        presets.put(Sensitivity.MEDIUM, new ThresholdMultipliers(2.0, 2.5, 3.0));
        presets.put(Sensitivity.LOW, new ThresholdMultipliers(2.5, 3.0, 3.5));
        return new SensitivityTable(presets);
    }

    /**
     * Returns a copy of this table with one tier replaced.
     *
     * @param tier        tier to override
     * @param replacement new multipliers for the tier
     * @return a new table
     */
    public SensitivityTable with(Sensitivity tier, ThresholdMultipliers replacement) {
        Map<Sensitivity, ThresholdMultipliers> copy = new EnumMap<>(multipliers);
        copy.put(tier, replacement);
        return new SensitivityTable(copy);
    }

    /**
     * @param tier sensitivity tier
     * @return multipliers configured for the tier
     */
    public ThresholdMultipliers resolve(Sensitivity tier) {
        ThresholdMultipliers resolved = multipliers.get(tier);
        if (resolved == null) {
            throw new IllegalStateException("No multipliers configured for sensitivity " + tier);
        }
        return resolved;
    }
}

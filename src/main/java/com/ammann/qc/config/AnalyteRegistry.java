/* (C)2026 */
package com.ammann.qc.config;

import com.ammann.qc.enumeration.Sensitivity;
import com.ammann.qc.exception.ValidationException;
import com.ammann.qc.model.ProcessParameters;
import com.ammann.qc.model.SensitivityTable;
import com.ammann.qc.model.ThresholdMultipliers;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Builds and holds the {@link ProcessParameters} of every configured analyte.
 *
 * <p>Parameters are resolved once at startup; a misconfigured analyte fails the boot
 * with a {@link ValidationException} naming the offending property.
 */
@ApplicationScoped
public class AnalyteRegistry {

    private static final Logger LOG = Logger.getLogger(AnalyteRegistry.class);

    private final SensitivityTable sensitivityTable;
    private final Map<String, ProcessParameters> analytes;
    private final Map<String, String> units;

    @Inject
    public AnalyteRegistry(QcConfig config) {
        this.sensitivityTable = sensitivityTable(config.sensitivity());
        Map<String, ProcessParameters> resolved = new TreeMap<>();
        Map<String, String> unitLabels = new TreeMap<>();
        config.analytes()
                .forEach(
                        (name, analyte) -> {
                            resolved.put(
                                    name, parameters(name, analyte, config.detection(), sensitivityTable));
                            analyte.unit().ifPresent(unit -> unitLabels.put(name, unit));
                        });
        this.analytes = Collections.unmodifiableMap(resolved);
        this.units = Collections.unmodifiableMap(unitLabels);
        LOG.infof("Configured %d analytes: %s", analytes.size(), analytes.keySet());
    }

    public AnalyteRegistry(Map<String, ProcessParameters> analytes, SensitivityTable sensitivityTable) {
        this.sensitivityTable = sensitivityTable;
        this.analytes = Collections.unmodifiableMap(new TreeMap<>(analytes));
        this.units = Map.of();
    }

    /**
     * @param name analyte name
     * @return parameters of the analyte, if configured
     */
    public Optional<ProcessParameters> find(String name) {
        return Optional.ofNullable(name).map(analytes::get);
    }

    public Map<String, ProcessParameters> all() {
        return analytes;
    }

    public Optional<String> unitOf(String name) {
        return Optional.ofNullable(units.get(name));
    }

    /** Sensitivity presets after configuration overrides. */
    public SensitivityTable sensitivityTable() {
        return sensitivityTable;
    }

    static SensitivityTable sensitivityTable(Map<String, QcConfig.Tier> overrides) {
        SensitivityTable table = SensitivityTable.defaults();
        for (Map.Entry<String, QcConfig.Tier> entry : overrides.entrySet()) {
            Sensitivity tier = parseSensitivity("qc.sensitivity", entry.getKey());
            QcConfig.Tier value = entry.getValue();
            table = table.with(tier, new ThresholdMultipliers(value.warning(), value.alert(), value.critical()));
        }
        return table;
    }

    static ProcessParameters parameters(
            String name,
            QcConfig.Analyte analyte,
            QcConfig.Detection detection,
            SensitivityTable table) {
        try {
            return ProcessParameters.builder(analyte.mean(), analyte.std())
                    .sensitivity(
                            parseSensitivity("qc.analytes." + name + ".sensitivity", analyte.sensitivity()),
                            table)
                    .cusum(detection.cusumK(), detection.cusumH())
                    .ewma(detection.ewmaLambda(), detection.ewmaL())
                    .anomalyThresholds(detection.anomalyThreshold(), detection.anomalyCriticalThreshold())
                    .trend(detection.trendWindow(), detection.trendSignificance())
                    .runRule(detection.runWindow(), detection.runMinimum())
                    .zigzag(detection.zigzagWindow(), detection.zigzagMinReversals())
                    .totalAllowableErrorPercent(analyte.teaPercent().orElse(null))
                    .build();
        } catch (ValidationException e) {
            throw new ValidationException("Analyte '" + name + "' is misconfigured: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a sensitivity label, reporting the property it came from.
     *
     * @param property configuration key or request field holding the label
     * @param label    tier label
     * @return the tier
     * @throws ValidationException for an unknown label
     */
    public static Sensitivity parseSensitivity(String property, String label) {
        try {
            return Sensitivity.fromLabel(label);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter(property, label, "one of high, medium, low");
        }
    }
}

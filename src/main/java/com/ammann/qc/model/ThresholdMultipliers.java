/* (C)2026 */
package com.ammann.qc.model;

import com.ammann.qc.exception.ValidationException;

/**
 * Warning, alert and critical limits of a sensitivity tier, in standard deviations.
 *
 * @param warning  distance from the mean at which a point enters the warning zone
 * @param alert    distance from the mean at which a point enters the alert zone
 * @param critical distance from the mean at which a point enters the critical zone
 */
public record ThresholdMultipliers(double warning, double alert, double critical) {

    public ThresholdMultipliers {
        if (!(warning > 0) || !Double.isFinite(warning)) {
            throw ValidationException.invalidParameter("warning", warning, "positive number");
        }
        if (!(alert >= warning) || !Double.isFinite(alert)) {
            throw ValidationException.invalidParameter("alert", alert, ">= warning (" + warning + ")");
        }
        if (!(critical >= alert) || !Double.isFinite(critical)) {
            throw ValidationException.invalidParameter(
                    "critical", critical, ">= alert (" + alert + ")");
        }
    }
}

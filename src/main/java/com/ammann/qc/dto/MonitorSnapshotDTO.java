/* (C)2026 */
package com.ammann.qc.dto;

import com.ammann.qc.enumeration.ControlZone;
import com.ammann.qc.model.Measurement;
import com.ammann.qc.service.MonitorSnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Current state of one monitored analyte")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonitorSnapshotDTO(
        @Schema(description = "Analyte name")
        String analyte,

        @Schema(description = "Whether the monitor is processing measurements")
        Boolean running,

        @Schema(description = "Measurements processed so far")
        Integer pointCount,

        @Schema(description = "Measurements waiting for the next ticks")
        Integer pending,

        @Schema(description = "Trailing measurements with their series index, oldest first")
        List<Measurement> trailing,

        @Schema(description = "Last processed value")
        Double latestValue,

        @Schema(description = "Control zone of the last processed value")
        ControlZone latestZone,

        @Schema(description = "Most recent violations, oldest first")
        List<ViolationDTO> violations,

        @Schema(description = "Statistics of the trailing values")
        QcStatisticsDTO statistics,

        @Schema(description = "Current upper CUSUM")
        Double cusumPositive,

        @Schema(description = "Current lower CUSUM")
        Double cusumNegative,

        @Schema(description = "Current EWMA")
        Double ewma,

        @Schema(description = "Time of the last update")
        Instant updatedAt
) {
    public static MonitorSnapshotDTO from(MonitorSnapshot snapshot, boolean running, int pending) {
        return new MonitorSnapshotDTO(
                snapshot.analyte(),
                running,
                snapshot.pointCount(),
                pending,
                snapshot.trailingMeasurements(),
                snapshot.latestValue(),
                snapshot.latestZone(),
                snapshot.violationLog().stream().map(ViolationDTO::from).toList(),
                QcStatisticsDTO.from(snapshot.statistics()),
                snapshot.cusumPositive(),
                snapshot.cusumNegative(),
                snapshot.ewma(),
                snapshot.updatedAt());
    }
}

/* (C)2026 */
package com.ammann.qc.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Measurement submitted to the real-time monitor")
public record MeasurementRequestDTO(
        @Schema(description = "Measured value", required = true, example = "1.02")
        Double value
) {}

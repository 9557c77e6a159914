package com.pharmacy.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
@Schema(description = "A recoverable degradation recorded during a run")
public class RunWarning {

    @Schema(description = "Warning category", example = "INVALID_FINDING")
    WarningType type;

    @Schema(description = "Detector the warning is attributed to, if any", example = "rejection_agent")
    String detectorName;

    @Schema(description = "Pharmacy the warning is about, if any", example = "PH-10042")
    String entityId;

    @Schema(description = "Warning detail")
    String message;
}

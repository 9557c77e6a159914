package com.pharmacy.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "A detector that produced no usable findings in this run")
public class DetectorFailure {

    @Schema(description = "Detector name", example = "network_agent")
    String detectorName;

    @Schema(description = "Failure category", example = "TIMEOUT")
    FailureReason reason;

    @Schema(description = "Failure detail", example = "Detector exceeded timeout of 30000 ms")
    String message;
}

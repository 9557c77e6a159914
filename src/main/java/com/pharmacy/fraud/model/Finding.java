package com.pharmacy.fraud.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "One detector's scored observation about one pharmacy")
public class Finding {

    @Schema(description = "Name of the detector that produced the finding", example = "coverage_agent")
    String detectorName;

    @Schema(description = "Pharmacy identifier", example = "PH-10042")
    String entityId;

    @Schema(description = "Risk score in [0, 1]", example = "0.85")
    double score;

    @Schema(description = "Human-readable explanation of the score",
            example = "92.3% of claims are cash or not covered")
    String reason;

    @Schema(description = "Detector-specific details (counts, ratios, ...)")
    @Builder.Default
    Map<String, Object> metadata = Map.of();

    /**
     * A finding is usable when both identifiers are present and the score is a finite value in [0, 1].
     */
    @JsonIgnore
    public boolean isWellFormed() {
        return detectorName != null && !detectorName.isBlank()
                && entityId != null && !entityId.isBlank()
                && !Double.isNaN(score) && score >= 0.0 && score <= 1.0;
    }
}

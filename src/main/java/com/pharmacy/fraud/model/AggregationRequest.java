package com.pharmacy.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Pre-computed detector output to score without running any detector")
public class AggregationRequest {

    @Schema(description = "Findings keyed by detector name")
    @Builder.Default
    private Map<String, List<Finding>> findings = new LinkedHashMap<>();

    @Schema(description = "Detectors that failed upstream, keyed by name, with the failure message")
    @Builder.Default
    private Map<String, String> failures = new LinkedHashMap<>();
}

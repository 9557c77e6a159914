package com.pharmacy.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Per-run detector statistics, review list and recommendations")
public class RunSummary {

    @Schema(description = "Number of ranked pharmacies", example = "120")
    int totalEntities;

    @Schema(description = "Number of pharmacies per risk level")
    Map<RiskLevel, Integer> riskLevelCounts;

    @Schema(description = "Statistics per detector, keyed by detector name")
    Map<String, DetectorPerformance> detectorPerformance;

    @Schema(description = "Pharmacies with conflicting detector signals and a high weighted score, in rank order")
    List<String> manualReviewEntityIds;

    @Schema(description = "Cross-detector agreement counts")
    CrossDetectorPatterns crossDetectorPatterns;

    @Schema(description = "Detectors that failed, timed out or returned only invalid findings")
    List<DetectorFailure> failures;

    @Schema(description = "Recoverable degradations recorded during the run")
    List<RunWarning> warnings;

    @Schema(description = "Deterministic recommendations derived from the counts above")
    List<String> recommendations;
}

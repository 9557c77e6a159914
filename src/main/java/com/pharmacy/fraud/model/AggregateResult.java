package com.pharmacy.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Schema(description = "Combined, ranked fraud-risk result for one pharmacy")
public class AggregateResult {

    @Schema(description = "Pharmacy identifier", example = "PH-10042")
    String entityId;

    @Schema(description = "Score reported by each contributing detector")
    Map<String, Double> perDetectorScores;

    @Schema(description = "Reason reported by each contributing detector")
    Map<String, String> perDetectorReasons;

    @Schema(description = "Weight-normalized average of the detector scores (0-1)", example = "0.9")
    double weightedScore;

    @Schema(description = "Agreement among contributing detectors (1 = full agreement)", example = "1.0")
    double consistencyScore;

    @Schema(description = "Population-relative anomaly strength of the weighted score (0-1)", example = "0.667")
    double outlierScore;

    @Schema(description = "weighted*0.7 + consistency*0.2 + outlier*0.1", example = "0.897")
    double finalScore;

    @Schema(description = "Risk level: VERY_LOW (<0.4), LOW (0.4-0.6), MEDIUM (0.6-0.8), HIGH (>=0.8)", example = "HIGH")
    RiskLevel riskLevel;

    @Schema(description = "Detectors that contributed to the weighted score", example = "[\"coverage_agent\", \"high_dollar_agent\"]")
    List<String> contributingDetectors;

    @Schema(description = "1-based rank, highest final score first", example = "1")
    int rank;

    @Schema(description = "Summary of the high and medium risk detector reasons")
    String explanation;
}

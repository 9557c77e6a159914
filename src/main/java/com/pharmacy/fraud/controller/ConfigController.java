package com.pharmacy.fraud.controller;

import com.pharmacy.fraud.config.ScoringProperties;
import com.pharmacy.fraud.exception.ConfigurationException;
import com.pharmacy.fraud.model.RunConfiguration;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify detector weights and scoring thresholds")
public class ConfigController {

    private final ScoringProperties scoringProperties;

    public ConfigController(ScoringProperties scoringProperties) {
        this.scoringProperties = scoringProperties;
    }

    // ── Weights ──

    @Operation(summary = "Get detector weights")
    @GetMapping("/weights")
    public ResponseEntity<Map<String, Double>> getWeights() {
        return ResponseEntity.ok(new TreeMap<>(scoringProperties.getWeights()));
    }

    @Operation(summary = "Replace detector weights",
            description = "Weights must be finite and >= 0; they need not sum to 1. Detectors left out weigh 0. " +
                    "Changes apply to the next run and reset on restart.")
    @PutMapping("/weights")
    public ResponseEntity<?> updateWeights(@RequestBody Map<String, Object> body) {
        if (body.isEmpty()) {
            return badRequest("weights must not be empty", "weights");
        }
        Map<String, Double> weights = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : body.entrySet()) {
            if (!(entry.getValue() instanceof Number n)) {
                return badRequest("Weight for detector '" + entry.getKey() + "' must be a number", "weights");
            }
            weights.put(entry.getKey(), n.doubleValue());
        }

        try {
            scoringProperties.toRunConfiguration().toBuilder()
                    .clearWeights()
                    .weights(weights)
                    .build()
                    .validate();
        } catch (ConfigurationException e) {
            return badRequest(e.getMessage(), e.getField());
        }

        scoringProperties.applyWeights(weights);
        return getWeights();
    }

    // ── Thresholds ──

    @Operation(summary = "Get scoring thresholds")
    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds() {
        return ResponseEntity.ok(Map.of(
                "conflictThreshold", scoringProperties.getConflictThreshold(),
                "highRiskThreshold", scoringProperties.getHighRiskThreshold(),
                "sigmaMax", scoringProperties.getSigmaMax(),
                "zScoreCap", scoringProperties.getZScoreCap(),
                "riskBucketBounds", List.copyOf(scoringProperties.getRiskBucketBounds())
        ));
    }

    @Operation(summary = "Update scoring thresholds",
            description = "Fields left out keep their current value. Changes apply to the next run and reset on restart.")
    @PutMapping("/thresholds")
    public ResponseEntity<?> updateThresholds(@RequestBody Map<String, Object> body) {
        RunConfiguration current = scoringProperties.toRunConfiguration();
        double conflict = toDouble(body, "conflictThreshold", current.getConflictThreshold());
        double highRisk = toDouble(body, "highRiskThreshold", current.getHighRiskThreshold());
        double sigmaMax = toDouble(body, "sigmaMax", current.getSigmaMax());
        double zScoreCap = toDouble(body, "zScoreCap", current.getZScoreCap());

        List<Double> bounds = new ArrayList<>(current.getRiskBucketBounds());
        Object rawBounds = body.get("riskBucketBounds");
        if (rawBounds != null) {
            if (!(rawBounds instanceof List<?> rawList)) {
                return badRequest("riskBucketBounds must be a list of three numbers", "riskBucketBounds");
            }
            bounds = new ArrayList<>();
            for (Object value : rawList) {
                if (!(value instanceof Number n)) {
                    return badRequest("riskBucketBounds must be a list of three numbers", "riskBucketBounds");
                }
                bounds.add(n.doubleValue());
            }
        }

        RunConfiguration candidate;
        try {
            candidate = current.toBuilder()
                    .conflictThreshold(conflict)
                    .highRiskThreshold(highRisk)
                    .sigmaMax(sigmaMax)
                    .zScoreCap(zScoreCap)
                    .riskBucketBounds(List.copyOf(bounds))
                    .build()
                    .validate();
        } catch (ConfigurationException e) {
            return badRequest(e.getMessage(), e.getField());
        }

        scoringProperties.applyThresholds(candidate);

        return getThresholds();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return Double.NaN; }
    }
}

package com.pharmacy.fraud.controller;

import com.pharmacy.fraud.config.ScoringProperties;
import com.pharmacy.fraud.engine.DispatchResult;
import com.pharmacy.fraud.engine.FindingValidator;
import com.pharmacy.fraud.model.AggregationRequest;
import com.pharmacy.fraud.model.DatasetSnapshot;
import com.pharmacy.fraud.model.RankingRequest;
import com.pharmacy.fraud.model.RankingRun;
import com.pharmacy.fraud.service.RankingRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/rankings")
@Tag(name = "Rankings", description = "Run detectors over a claims snapshot and rank pharmacies by fraud risk")
public class RankingController {

    private final RankingRunService rankingRunService;
    private final FindingValidator findingValidator;
    private final ScoringProperties scoringProperties;

    public RankingController(RankingRunService rankingRunService,
                             FindingValidator findingValidator,
                             ScoringProperties scoringProperties) {
        this.rankingRunService = rankingRunService;
        this.findingValidator = findingValidator;
        this.scoringProperties = scoringProperties;
    }

    @Operation(summary = "Rank pharmacies for a claims snapshot",
            description = "Runs every registered detector in parallel over the submitted claims, then aggregates, " +
                    "classifies and ranks every pharmacy that received at least one weighted finding. " +
                    "Detector failures and timeouts are reported in the summary.")
    @PostMapping("/run")
    public ResponseEntity<RankingRun> run(@RequestBody RankingRequest request) {
        if (request.getClaims() == null) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(rankingRunService.run(DatasetSnapshot.of(request.getClaims())));
    }

    @Operation(summary = "Rank pre-computed detector findings",
            description = "Scores findings produced outside this service with the current weights and thresholds. " +
                    "Findings go through the same validation as a live run.")
    @PostMapping("/aggregate")
    public ResponseEntity<RankingRun> aggregate(@RequestBody AggregationRequest request) {
        DispatchResult dispatch = findingValidator.toDispatchResult(
                request.getFindings() == null ? Map.of() : request.getFindings(),
                request.getFailures() == null ? Map.of() : request.getFailures());
        return ResponseEntity.ok(rankingRunService.aggregate(dispatch));
    }

    @Operation(summary = "List registered detectors with their configured weights")
    @GetMapping("/detectors")
    public ResponseEntity<List<Map<String, Object>>> getDetectors() {
        Map<String, Double> weights = scoringProperties.getWeights();
        List<Map<String, Object>> detectors = rankingRunService.getDetectorNames().stream()
                .map(name -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("name", name);
                    entry.put("weight", weights.getOrDefault(name, 0.0));
                    return entry;
                })
                .toList();
        return ResponseEntity.ok(detectors);
    }
}

package com.pharmacy.fraud.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmacy.fraud.config.ScoringProperties;
import com.pharmacy.fraud.engine.DispatchResult;
import com.pharmacy.fraud.engine.FindingValidator;
import com.pharmacy.fraud.exception.ConfigurationException;
import com.pharmacy.fraud.exception.RunCancelledException;
import com.pharmacy.fraud.model.*;
import com.pharmacy.fraud.service.RankingRunService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.pharmacy.fraud.testutil.TestDataFactory.claim;
import static com.pharmacy.fraud.testutil.TestDataFactory.finding;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RankingController.class)
@Import(FindingValidator.class)
class RankingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RankingRunService rankingRunService;

    @MockBean
    private ScoringProperties scoringProperties;

    @Test
    void run_success() throws Exception {
        when(rankingRunService.run(any(DatasetSnapshot.class))).thenReturn(sampleRun());

        mockMvc.perform(post("/api/v1/rankings/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(RankingRequest.builder()
                                .claims(List.of(
                                        claim("CLM-1", "PH-1", "CASH", 250.0),
                                        claim("CLM-2", "PH-2", "COMMERCIAL", 40.0)))
                                .build())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-1"))
                .andExpect(jsonPath("$.results[0].entityId").value("PH-1"))
                .andExpect(jsonPath("$.results[0].riskLevel").value("HIGH"))
                .andExpect(jsonPath("$.results[0].rank").value(1))
                .andExpect(jsonPath("$.summary.manualReviewEntityIds[0]").value("PH-1"));

        ArgumentCaptor<DatasetSnapshot> captor = ArgumentCaptor.forClass(DatasetSnapshot.class);
        verify(rankingRunService).run(captor.capture());
        assertThat(captor.getValue().getClaims()).extracting(ClaimRecord::getPharmacyNumber)
                .containsExactly("PH-1", "PH-2");
    }

    @Test
    void run_missingClaims_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/rankings/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"claims\": null}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(rankingRunService);
    }

    @Test
    void run_cancelled_returns503() throws Exception {
        when(rankingRunService.run(any(DatasetSnapshot.class)))
                .thenThrow(new RunCancelledException("Run run-1 was cancelled while waiting for detectors", null));

        mockMvc.perform(post("/api/v1/rankings/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"claims\": []}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Run cancelled"));
    }

    @Test
    void run_invalidConfiguration_returns400WithField() throws Exception {
        when(rankingRunService.run(any(DatasetSnapshot.class)))
                .thenThrow(new ConfigurationException("sigmaMax", "sigmaMax must be > 0, was 0.0"));

        mockMvc.perform(post("/api/v1/rankings/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"claims\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("sigmaMax"))
                .andExpect(jsonPath("$.message").value("sigmaMax must be > 0, was 0.0"));
    }

    @Test
    void aggregate_validatesFindingsBeforeScoring() throws Exception {
        when(rankingRunService.aggregate(any(DispatchResult.class))).thenReturn(sampleRun());
        AggregationRequest request = AggregationRequest.builder()
                .findings(Map.of("coverage_agent", List.of(
                        finding("coverage_agent", "PH-1", 0.9),
                        finding("coverage_agent", "PH-2", 1.7))))
                .failures(Map.of("network_agent", "graph service unavailable"))
                .build();

        mockMvc.perform(post("/api/v1/rankings/aggregate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].entityId").value("PH-1"));

        ArgumentCaptor<DispatchResult> captor = ArgumentCaptor.forClass(DispatchResult.class);
        verify(rankingRunService).aggregate(captor.capture());
        DispatchResult dispatch = captor.getValue();
        assertThat(dispatch.getResults().get("coverage_agent")).extracting(Finding::getEntityId).containsExactly("PH-1");
        assertThat(dispatch.getFailures()).containsOnlyKeys("network_agent");
        assertThat(dispatch.getWarnings()).extracting(RunWarning::getType).containsExactly(WarningType.INVALID_FINDING);
    }

    @Test
    void aggregate_withoutFailures_usesEmptyFailureMap() throws Exception {
        when(rankingRunService.aggregate(any(DispatchResult.class))).thenReturn(sampleRun());
        AggregationRequest request = AggregationRequest.builder()
                .findings(Map.of("coverage_agent", List.of(finding("coverage_agent", "PH-1", 0.9))))
                .build();

        assertThat(request.getFailures()).isEmpty();

        mockMvc.perform(post("/api/v1/rankings/aggregate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk());

        ArgumentCaptor<DispatchResult> captor = ArgumentCaptor.forClass(DispatchResult.class);
        verify(rankingRunService).aggregate(captor.capture());
        assertThat(captor.getValue().getResults()).containsOnlyKeys("coverage_agent");
        assertThat(captor.getValue().getFailures()).isEmpty();
    }

    @Test
    void run_emptyRequestBuilder_hasNoClaims() throws Exception {
        when(rankingRunService.run(any(DatasetSnapshot.class))).thenReturn(sampleRun());

        mockMvc.perform(post("/api/v1/rankings/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(RankingRequest.builder().build())))
                .andExpect(status().isOk());

        ArgumentCaptor<DatasetSnapshot> captor = ArgumentCaptor.forClass(DatasetSnapshot.class);
        verify(rankingRunService).run(captor.capture());
        assertThat(captor.getValue().getClaims()).isEmpty();
    }

    @Test
    void getDetectors_returnsNamesWithWeights() throws Exception {
        when(rankingRunService.getDetectorNames()).thenReturn(List.of("coverage_agent", "velocity_agent"));
        when(scoringProperties.getWeights()).thenReturn(Map.of("coverage_agent", 0.25));

        mockMvc.perform(get("/api/v1/rankings/detectors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("coverage_agent"))
                .andExpect(jsonPath("$[0].weight").value(0.25))
                .andExpect(jsonPath("$[1].name").value("velocity_agent"))
                .andExpect(jsonPath("$[1].weight").value(0.0));
    }

    private static RankingRun sampleRun() {
        AggregateResult top = AggregateResult.builder()
                .entityId("PH-1")
                .perDetectorScores(Map.of("coverage_agent", 0.9))
                .perDetectorReasons(Map.of("coverage_agent", "92% cash claims"))
                .weightedScore(0.9)
                .consistencyScore(1.0)
                .outlierScore(0.0)
                .finalScore(0.83)
                .riskLevel(RiskLevel.HIGH)
                .contributingDetectors(List.of("coverage_agent"))
                .rank(1)
                .explanation("HIGH RISK from 1 detector: 92% cash claims")
                .build();
        RunSummary summary = RunSummary.builder()
                .totalEntities(1)
                .riskLevelCounts(Map.of(RiskLevel.HIGH, 1))
                .detectorPerformance(Map.of())
                .manualReviewEntityIds(List.of("PH-1"))
                .crossDetectorPatterns(CrossDetectorPatterns.builder().build())
                .failures(List.of())
                .warnings(List.of())
                .recommendations(List.of())
                .build();
        return RankingRun.builder()
                .runId("run-1")
                .snapshotId("snap-1")
                .startedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .completedAt(Instant.parse("2024-05-01T10:00:02Z"))
                .results(List.of(top))
                .summary(summary)
                .build();
    }
}

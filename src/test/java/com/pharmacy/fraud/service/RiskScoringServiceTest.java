package com.pharmacy.fraud.service;

import com.pharmacy.fraud.model.AggregateResult;
import com.pharmacy.fraud.model.RiskLevel;
import com.pharmacy.fraud.model.RunConfiguration;
import com.pharmacy.fraud.scoring.OutlierAssessment;
import com.pharmacy.fraud.scoring.PartialAggregate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskScoringServiceTest {

    private RiskScoringService scoringService;
    private RunConfiguration config;

    @BeforeEach
    void setUp() {
        scoringService = new RiskScoringService();
        config = RunConfiguration.builder().weight("a", 0.6).weight("b", 0.4).build();
    }

    @Test
    void compose_corroboratedOutlier_isHighRisk() {
        PartialAggregate partial = partial("PH-X", 0.9, "a", 0.9, "b", 0.9);

        AggregateResult result = scoringService.compose(partial, 1.0, new OutlierAssessment(2.0, 2.0 / 3.0), config);

        assertThat(result.getFinalScore()).isCloseTo(0.8967, within(0.0001));
        assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.getOutlierScore()).isCloseTo(0.667, within(0.001));
        assertThat(result.getContributingDetectors()).containsExactly("a", "b");
        assertThat(result.getRank()).isZero();
    }

    @Test
    void finalScore_belowMeanOutlier_doesNotAddRisk() {
        double belowMean = RiskScoringService.finalScore(0.1, 1.0, new OutlierAssessment(-2.5, 0.833));
        double neutral = RiskScoringService.finalScore(0.1, 1.0, OutlierAssessment.NEUTRAL);

        assertThat(belowMean).isEqualTo(neutral);
        assertThat(belowMean).isCloseTo(0.27, within(1e-12));
    }

    @Test
    void finalScore_maximalInputs_staysWithinUnitInterval() {
        assertThat(RiskScoringService.finalScore(1.0, 1.0, new OutlierAssessment(10.0, 1.0))).isLessThanOrEqualTo(1.0);
        assertThat(RiskScoringService.finalScore(0.0, 0.0, OutlierAssessment.NEUTRAL)).isEqualTo(0.0);
    }

    @Test
    void compose_customBounds_usedForClassification() {
        RunConfiguration shifted = config.toBuilder().riskBucketBounds(List.of(0.1, 0.2, 0.3)).build();
        PartialAggregate partial = partial("PH-1", 0.2, "a", 0.2);

        AggregateResult result = scoringService.compose(partial, 1.0, OutlierAssessment.NEUTRAL, shifted);

        // 0.14 + 0.2 = 0.34
        assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void rank_ordersByScoreThenEntityId() {
        List<AggregateResult> ranked = scoringService.rank(List.of(
                result("PH-C", 0.5),
                result("PH-B", 0.9),
                result("PH-A", 0.5),
                result("PH-D", 0.1)));

        assertThat(ranked).extracting(AggregateResult::getEntityId).containsExactly("PH-B", "PH-A", "PH-C", "PH-D");
        assertThat(ranked).extracting(AggregateResult::getRank).containsExactly(1, 2, 3, 4);
    }

    @Test
    void rank_emptyInput_returnsEmpty() {
        assertThat(scoringService.rank(List.of())).isEmpty();
    }

    @Test
    void explain_groupsHighAndMediumReasons() {
        SortedMap<String, Double> scores = new TreeMap<>();
        scores.put("a", 0.9);
        scores.put("b", 0.7);
        scores.put("c", 0.85);
        scores.put("d", 0.1);
        SortedMap<String, String> reasons = new TreeMap<>();
        reasons.put("a", "92% cash claims");
        reasons.put("b", "patient flips across 6 pharmacies");
        reasons.put("c", "");
        reasons.put("d", "normal rejection rate");

        String explanation = scoringService.explain(new PartialAggregate("PH-1", scores, reasons, 0.6), config);

        assertThat(explanation).isEqualTo("HIGH RISK from 2 detectors: 92% cash claims, c"
                + " | MEDIUM RISK from 1 detector: patient flips across 6 pharmacies");
    }

    @Test
    void explain_noSignals_returnsNeutralText() {
        String explanation = scoringService.explain(partial("PH-1", 0.2, "a", 0.2, "b", 0.3), config);

        assertThat(explanation).isEqualTo("Multiple detector analysis completed - no significant fraud indicators detected");
    }

    private static PartialAggregate partial(String entityId, double weighted, Object... detectorScores) {
        SortedMap<String, Double> scores = new TreeMap<>();
        SortedMap<String, String> reasons = new TreeMap<>();
        for (int i = 0; i < detectorScores.length; i += 2) {
            scores.put((String) detectorScores[i], (Double) detectorScores[i + 1]);
            reasons.put((String) detectorScores[i], detectorScores[i] + " reason");
        }
        return new PartialAggregate(entityId, scores, reasons, weighted);
    }

    private static AggregateResult result(String entityId, double finalScore) {
        return AggregateResult.builder()
                .entityId(entityId)
                .finalScore(finalScore)
                .riskLevel(RiskLevel.fromScore(finalScore))
                .build();
    }
}

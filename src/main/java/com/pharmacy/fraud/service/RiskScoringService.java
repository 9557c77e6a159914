package com.pharmacy.fraud.service;

import com.pharmacy.fraud.model.AggregateResult;
import com.pharmacy.fraud.model.RiskLevel;
import com.pharmacy.fraud.model.RunConfiguration;
import com.pharmacy.fraud.scoring.OutlierAssessment;
import com.pharmacy.fraud.scoring.PartialAggregate;
import com.pharmacy.fraud.scoring.ScoreStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Computes the final risk score of each pharmacy, buckets it into a risk level and ranks the run.
 *
 * finalScore = weighted × 0.7 + consistency × 0.2 + outlier × 0.1
 *
 * The coefficients are fixed so final scores stay comparable across runs. The outlier term only
 * counts for pharmacies above the population mean.
 */
@Service
public class RiskScoringService {

    static final double WEIGHTED_COEFFICIENT = 0.7;
    static final double CONSISTENCY_COEFFICIENT = 0.2;
    static final double OUTLIER_COEFFICIENT = 0.1;

    private static final Comparator<AggregateResult> RANK_ORDER =
            Comparator.comparingDouble(AggregateResult::getFinalScore).reversed()
                    .thenComparing(AggregateResult::getEntityId);

    public static double finalScore(double weightedScore, double consistencyScore, OutlierAssessment outlier) {
        double outlierComponent = outlier.isAboveMean() ? outlier.getScore() : 0.0;
        return ScoreStatistics.clampUnit(weightedScore * WEIGHTED_COEFFICIENT
                + consistencyScore * CONSISTENCY_COEFFICIENT
                + outlierComponent * OUTLIER_COEFFICIENT);
    }

    /**
     * Build the unranked result of one pharmacy.
     */
    public AggregateResult compose(PartialAggregate partial, double consistencyScore,
                                   OutlierAssessment outlier, RunConfiguration config) {
        double finalScore = finalScore(partial.getWeightedScore(), consistencyScore, outlier);

        return AggregateResult.builder()
                .entityId(partial.getEntityId())
                .perDetectorScores(partial.getPerDetectorScores())
                .perDetectorReasons(partial.getPerDetectorReasons())
                .weightedScore(partial.getWeightedScore())
                .consistencyScore(consistencyScore)
                .outlierScore(outlier.getScore())
                .finalScore(finalScore)
                .riskLevel(RiskLevel.fromScore(finalScore, config.getRiskBucketBounds()))
                .contributingDetectors(partial.getContributingDetectors())
                .explanation(explain(partial, config))
                .build();
    }

    /**
     * Sort by final score descending, pharmacy id ascending, and assign ranks 1..N.
     */
    public List<AggregateResult> rank(List<AggregateResult> results) {
        List<AggregateResult> sorted = new ArrayList<>(results);
        sorted.sort(RANK_ORDER);

        List<AggregateResult> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).toBuilder().rank(i + 1).build());
        }
        return List.copyOf(ranked);
    }

    String explain(PartialAggregate partial, RunConfiguration config) {
        List<String> high = reasonsWithin(partial, config.highBound(), Double.POSITIVE_INFINITY);
        List<String> medium = reasonsWithin(partial, config.mediumBound(), config.highBound());

        List<String> parts = new ArrayList<>();
        if (!high.isEmpty()) {
            parts.add("HIGH RISK from " + describeCount(high.size()) + ": " + String.join(", ", high));
        }
        if (!medium.isEmpty()) {
            parts.add("MEDIUM RISK from " + describeCount(medium.size()) + ": " + String.join(", ", medium));
        }
        if (parts.isEmpty()) {
            return "Multiple detector analysis completed - no significant fraud indicators detected";
        }
        return String.join(" | ", parts);
    }

    private static List<String> reasonsWithin(PartialAggregate partial, double lower, double upper) {
        return partial.getPerDetectorScores().entrySet().stream()
                .filter(e -> e.getValue() >= lower && e.getValue() < upper)
                .map(Map.Entry::getKey)
                .map(name -> {
                    String reason = partial.getPerDetectorReasons().get(name);
                    return reason == null || reason.isBlank() ? name : reason;
                })
                .collect(Collectors.toList());
    }

    private static String describeCount(int count) {
        return count == 1 ? "1 detector" : count + " detectors";
    }
}

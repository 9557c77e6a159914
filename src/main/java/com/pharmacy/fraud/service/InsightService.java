package com.pharmacy.fraud.service;

import com.pharmacy.fraud.engine.DispatchResult;
import com.pharmacy.fraud.model.AggregateResult;
import com.pharmacy.fraud.model.CrossDetectorPatterns;
import com.pharmacy.fraud.model.DetectorAssessment;
import com.pharmacy.fraud.model.DetectorFailure;
import com.pharmacy.fraud.model.DetectorPerformance;
import com.pharmacy.fraud.model.Finding;
import com.pharmacy.fraud.model.RiskLevel;
import com.pharmacy.fraud.model.RunConfiguration;
import com.pharmacy.fraud.model.RunSummary;
import com.pharmacy.fraud.model.RunWarning;
import com.pharmacy.fraud.scoring.ConsistencyAnalyzer;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summarizes a completed run: how each detector behaved, which pharmacies need a manual review,
 * how often detectors agreed or conflicted, and what to look at next.
 * Everything here is derived from counts, so the same run always yields the same summary.
 */
@Service
public class InsightService {

    private final ConsistencyAnalyzer consistencyAnalyzer;

    public InsightService(ConsistencyAnalyzer consistencyAnalyzer) {
        this.consistencyAnalyzer = consistencyAnalyzer;
    }

    public RunSummary summarize(DispatchResult dispatch, List<AggregateResult> ranked,
                                List<RunWarning> warnings, RunConfiguration config) {
        Map<String, DetectorPerformance> performance = detectorPerformance(dispatch, config);
        Map<RiskLevel, Integer> levelCounts = riskLevelCounts(ranked);
        List<String> manualReview = manualReviewList(ranked, config);
        CrossDetectorPatterns patterns = crossDetectorPatterns(ranked, config);
        List<DetectorFailure> failures = List.copyOf(dispatch.getFailures().values());

        return RunSummary.builder()
                .totalEntities(ranked.size())
                .riskLevelCounts(levelCounts)
                .detectorPerformance(performance)
                .manualReviewEntityIds(manualReview)
                .crossDetectorPatterns(patterns)
                .failures(failures)
                .warnings(List.copyOf(warnings))
                .recommendations(recommendations(levelCounts, performance, patterns, manualReview, failures, config))
                .build();
    }

    /**
     * Per detector: average score, HIGH findings and an assessment relative to the other detectors.
     */
    Map<String, DetectorPerformance> detectorPerformance(DispatchResult dispatch, RunConfiguration config) {
        Map<String, int[]> counts = new TreeMap<>();    // name -> [highRisk, total]
        Map<String, Double> averages = new TreeMap<>();

        for (Map.Entry<String, List<Finding>> entry : dispatch.getResults().entrySet()) {
            int high = 0;
            double sum = 0.0;
            for (Finding finding : entry.getValue()) {
                sum += finding.getScore();
                if (finding.getScore() >= config.highBound()) high++;
            }
            int total = entry.getValue().size();
            counts.put(entry.getKey(), new int[]{high, total});
            averages.put(entry.getKey(), total > 0 ? sum / total : 0.0);
        }

        double meanHigh = counts.values().stream().mapToInt(c -> c[0]).average().orElse(0.0);

        Map<String, DetectorPerformance> performance = new TreeMap<>();
        for (Map.Entry<String, int[]> entry : counts.entrySet()) {
            int high = entry.getValue()[0];
            performance.put(entry.getKey(), DetectorPerformance.builder()
                    .detectorName(entry.getKey())
                    .averageScore(averages.get(entry.getKey()))
                    .highRiskFindings(high)
                    .totalFindings(entry.getValue()[1])
                    .assessment(assess(high, meanHigh, config.getSensitivityFactor()))
                    .build());
        }
        for (String failed : dispatch.getFailures().keySet()) {
            performance.put(failed, DetectorPerformance.builder()
                    .detectorName(failed)
                    .assessment(DetectorAssessment.FAILED)
                    .build());
        }
        return Collections.unmodifiableMap(performance);
    }

    static DetectorAssessment assess(int highRiskFindings, double meanHighRiskFindings, double factor) {
        if (meanHighRiskFindings <= 0.0) {
            return DetectorAssessment.NORMAL;
        }
        if (highRiskFindings > meanHighRiskFindings * factor) {
            return DetectorAssessment.TOO_SENSITIVE;
        }
        if (highRiskFindings < meanHighRiskFindings / factor) {
            return DetectorAssessment.UNDERPERFORMING;
        }
        return DetectorAssessment.NORMAL;
    }

    List<String> manualReviewList(List<AggregateResult> ranked, RunConfiguration config) {
        return ranked.stream()
                .filter(r -> consistencyAnalyzer.requiresManualReview(r.getConsistencyScore(), r.getWeightedScore(), config))
                .map(AggregateResult::getEntityId)
                .toList();
    }

    CrossDetectorPatterns crossDetectorPatterns(List<AggregateResult> ranked, RunConfiguration config) {
        int conflicting = 0;
        int highConsistency = 0;
        int corroborated = 0;

        for (AggregateResult result : ranked) {
            Collection<Double> scores = result.getPerDetectorScores().values();
            long high = scores.stream().filter(s -> s >= config.highBound()).count();
            long low = scores.stream().filter(s -> s < config.lowBound()).count();

            if (high > 0 && low > 0) conflicting++;
            if ((high >= 3 && high == scores.size()) || (low >= 3 && low == scores.size())) highConsistency++;
            if (high >= 2) corroborated++;
        }

        return CrossDetectorPatterns.builder()
                .conflictingSignals(conflicting)
                .highConsistency(highConsistency)
                .corroboratedHighRisk(corroborated)
                .build();
    }

    Map<RiskLevel, Integer> riskLevelCounts(List<AggregateResult> ranked) {
        Map<RiskLevel, Integer> counts = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            counts.put(level, 0);
        }
        ranked.forEach(r -> counts.merge(r.getRiskLevel(), 1, Integer::sum));
        return Collections.unmodifiableMap(counts);
    }

    List<String> recommendations(Map<RiskLevel, Integer> levelCounts,
                                 Map<String, DetectorPerformance> performance,
                                 CrossDetectorPatterns patterns,
                                 List<String> manualReview,
                                 List<DetectorFailure> failures,
                                 RunConfiguration config) {
        List<String> recommendations = new ArrayList<>();

        int high = levelCounts.get(RiskLevel.HIGH);
        int medium = levelCounts.get(RiskLevel.MEDIUM);
        if (high > config.getHighRiskAlertCount()) {
            recommendations.add(String.format(
                    "%d high-risk pharmacies detected - consider manual review", high));
        }
        if (medium > config.getMediumRiskAlertCount()) {
            recommendations.add(String.format(
                    "%d medium-risk pharmacies - consider adjusting thresholds", medium));
        }
        if (patterns.getConflictingSignals() > config.getConflictAlertCount()) {
            recommendations.add(String.format(
                    "%d pharmacies with conflicting detector signals - review detector weights",
                    patterns.getConflictingSignals()));
        }
        if (patterns.getHighConsistency() > config.getConsistencyAlertCount()) {
            recommendations.add(String.format(
                    "%d pharmacies with strong detector agreement - consider increasing the confidence threshold",
                    patterns.getHighConsistency()));
        }

        for (DetectorPerformance p : new TreeMap<>(performance).values()) {
            if (p.getAssessment() == DetectorAssessment.TOO_SENSITIVE) {
                recommendations.add(String.format(
                        "Detector %s flagged %d pharmacies as HIGH, well above the other detectors - it may be too sensitive",
                        p.getDetectorName(), p.getHighRiskFindings()));
            } else if (p.getAssessment() == DetectorAssessment.UNDERPERFORMING) {
                recommendations.add(String.format(
                        "Detector %s flagged only %d pharmacies as HIGH, well below the other detectors - it may be underperforming",
                        p.getDetectorName(), p.getHighRiskFindings()));
            }
        }
        for (DetectorFailure failure : failures) {
            recommendations.add(String.format("Detector %s did not contribute (%s): %s",
                    failure.getDetectorName(), failure.getReason(), failure.getMessage()));
        }
        if (!manualReview.isEmpty()) {
            recommendations.add(String.format(
                    "%d pharmacies have conflicting signals on a high weighted score - manual review required",
                    manualReview.size()));
        }
        return List.copyOf(recommendations);
    }
}

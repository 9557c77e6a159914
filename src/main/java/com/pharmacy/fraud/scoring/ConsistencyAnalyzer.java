package com.pharmacy.fraud.scoring;

import com.pharmacy.fraud.model.RunConfiguration;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Measures how much the detectors reporting on one pharmacy agree.
 *
 * consistency = 1 - min(σ / sigmaMax, 1) where σ is the population standard deviation of the
 * contributing scores. A single detector has nothing to disagree with and scores 1.
 */
@Component
public class ConsistencyAnalyzer {

    public double consistency(Map<String, Double> perDetectorScores, RunConfiguration config) {
        if (perDetectorScores.size() < 2) {
            return 1.0;
        }
        double sigma = ScoreStatistics.populationStdDev(perDetectorScores.values());
        if (sigma < ScoreStatistics.EPSILON) {
            return 1.0;
        }
        double disagreement = Math.min(sigma / config.getSigmaMax(), 1.0);
        return ScoreStatistics.clampUnit(1.0 - disagreement);
    }

    /**
     * Conflicting signals on a high weighted score need a human decision. Both conditions are required.
     */
    public boolean requiresManualReview(double consistencyScore, double weightedScore, RunConfiguration config) {
        return consistencyScore < config.getConflictThreshold()
                && weightedScore > config.getHighRiskThreshold();
    }
}

package com.pharmacy.fraud.scoring;

import com.pharmacy.fraud.model.RunConfiguration;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Scores each pharmacy's weighted score against the distribution of all weighted scores in the run.
 *
 * score = min(|z| / zScoreCap, 1). The score is symmetric; the sign of z is kept so composition
 * can ignore pharmacies far below the mean.
 */
@Component
public class OutlierAnalyzer {

    public SortedMap<String, OutlierAssessment> assess(SortedMap<String, Double> weightedScores,
                                                       RunConfiguration config) {
        SortedMap<String, OutlierAssessment> assessments = new TreeMap<>();
        if (weightedScores.size() < 2) {
            weightedScores.keySet().forEach(id -> assessments.put(id, OutlierAssessment.NEUTRAL));
            return Collections.unmodifiableSortedMap(assessments);
        }

        double mean = ScoreStatistics.mean(weightedScores.values());
        double sigma = ScoreStatistics.populationStdDev(weightedScores.values());

        for (Map.Entry<String, Double> entry : weightedScores.entrySet()) {
            if (sigma < ScoreStatistics.EPSILON) {
                assessments.put(entry.getKey(), OutlierAssessment.NEUTRAL);
                continue;
            }
            double z = (entry.getValue() - mean) / sigma;
            double score = Math.min(Math.abs(z) / config.getZScoreCap(), 1.0);
            assessments.put(entry.getKey(), new OutlierAssessment(z, score));
        }
        return Collections.unmodifiableSortedMap(assessments);
    }
}

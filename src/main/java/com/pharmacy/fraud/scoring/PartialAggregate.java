package com.pharmacy.fraud.scoring;

import lombok.Value;

import java.util.List;
import java.util.SortedMap;

/**
 * Per-pharmacy output of the weighted aggregation, before consistency, outlier and ranking.
 */
@Value
public class PartialAggregate {
    String entityId;
    SortedMap<String, Double> perDetectorScores;
    SortedMap<String, String> perDetectorReasons;
    double weightedScore;

    public List<String> getContributingDetectors() {
        return List.copyOf(perDetectorScores.keySet());
    }
}

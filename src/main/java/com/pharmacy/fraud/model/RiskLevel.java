package com.pharmacy.fraud.model;

import java.util.List;

public enum RiskLevel {
    HIGH,
    MEDIUM,
    LOW,
    VERY_LOW;

    public static final List<Double> DEFAULT_BOUNDS = List.of(0.4, 0.6, 0.8);

    public static RiskLevel fromScore(double score) {
        return fromScore(score, DEFAULT_BOUNDS);
    }

    /**
     * Buckets a score using ascending bounds [low, medium, high]. Each bucket is closed on its lower bound.
     */
    public static RiskLevel fromScore(double score, List<Double> bounds) {
        if (score >= bounds.get(2)) return HIGH;
        if (score >= bounds.get(1)) return MEDIUM;
        if (score >= bounds.get(0)) return LOW;
        return VERY_LOW;
    }
}

package com.pharmacy.fraud.model;

import com.pharmacy.fraud.exception.ConfigurationException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable configuration of a single ranking run. Frozen from the bound properties when a run
 * starts, so later property updates never affect a run in flight.
 */
@Value
@Builder(toBuilder = true)
public class RunConfiguration {

    @Singular
    Map<String, Double> weights;

    @Builder.Default
    double conflictThreshold = 0.5;

    @Builder.Default
    double highRiskThreshold = 0.6;

    @Builder.Default
    double sigmaMax = 0.5;

    @Builder.Default
    double zScoreCap = 3.0;

    @Builder.Default
    List<Double> riskBucketBounds = RiskLevel.DEFAULT_BOUNDS;

    @Builder.Default
    Duration detectorTimeout = Duration.ofSeconds(30);

    @Builder.Default
    int maxWorkers = 5;

    @Builder.Default
    double sensitivityFactor = 1.5;

    @Builder.Default
    int highRiskAlertCount = 10;

    @Builder.Default
    int mediumRiskAlertCount = 20;

    @Builder.Default
    int conflictAlertCount = 5;

    @Builder.Default
    int consistencyAlertCount = 10;

    /**
     * Weight of a detector; detectors missing from the weight map weigh 0.
     */
    public double weightOf(String detectorName) {
        Double weight = weights.get(detectorName);
        return weight == null ? 0.0 : weight;
    }

    public double highBound() {
        return riskBucketBounds.get(2);
    }

    public double mediumBound() {
        return riskBucketBounds.get(1);
    }

    public double lowBound() {
        return riskBucketBounds.get(0);
    }

    public Map<String, Double> sortedWeights() {
        return new TreeMap<>(weights);
    }

    /**
     * @throws ConfigurationException on the first invalid value
     */
    public RunConfiguration validate() {
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new ConfigurationException("weights", "Detector names in the weight map must not be blank");
            }
            Double weight = entry.getValue();
            if (weight == null || weight.isNaN() || weight.isInfinite() || weight < 0) {
                throw new ConfigurationException("weights",
                        "Weight for detector '" + entry.getKey() + "' must be a finite value >= 0, was " + weight);
            }
        }
        requireUnitInterval("conflictThreshold", conflictThreshold);
        requireUnitInterval("highRiskThreshold", highRiskThreshold);
        if (!(sigmaMax > 0) || Double.isInfinite(sigmaMax)) {
            throw new ConfigurationException("sigmaMax", "sigmaMax must be > 0, was " + sigmaMax);
        }
        if (!(zScoreCap > 0) || Double.isInfinite(zScoreCap)) {
            throw new ConfigurationException("zScoreCap", "zScoreCap must be > 0, was " + zScoreCap);
        }
        validateBounds();
        if (detectorTimeout == null || detectorTimeout.isZero() || detectorTimeout.isNegative()) {
            throw new ConfigurationException("detectorTimeout", "detectorTimeout must be positive, was " + detectorTimeout);
        }
        if (maxWorkers <= 0) {
            throw new ConfigurationException("maxWorkers", "maxWorkers must be > 0, was " + maxWorkers);
        }
        if (!(sensitivityFactor >= 1.0) || Double.isInfinite(sensitivityFactor)) {
            throw new ConfigurationException("sensitivityFactor", "sensitivityFactor must be >= 1, was " + sensitivityFactor);
        }
        if (highRiskAlertCount < 0 || mediumRiskAlertCount < 0 || conflictAlertCount < 0 || consistencyAlertCount < 0) {
            throw new ConfigurationException("insight", "Recommendation alert counts must be >= 0");
        }
        return this;
    }

    private void validateBounds() {
        if (riskBucketBounds == null || riskBucketBounds.size() != 3) {
            throw new ConfigurationException("riskBucketBounds", "riskBucketBounds must contain exactly three values");
        }
        double previous = -1.0;
        for (Double bound : riskBucketBounds) {
            if (bound == null || bound.isNaN() || bound < 0.0 || bound > 1.0) {
                throw new ConfigurationException("riskBucketBounds", "riskBucketBounds must lie in [0, 1], got " + riskBucketBounds);
            }
            if (bound <= previous) {
                throw new ConfigurationException("riskBucketBounds",
                        "riskBucketBounds must be strictly ascending, got " + riskBucketBounds);
            }
            previous = bound;
        }
    }

    private static void requireUnitInterval(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(field, field + " must be in [0, 1], was " + value);
        }
    }
}

package com.pharmacy.fraud.config;

import com.pharmacy.fraud.model.RunConfiguration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    // Detector name -> weight. Need not sum to 1; detectors missing here weigh 0.
    private Map<String, Double> weights = defaultWeights();

    // Consistency below this marks conflicting detector signals
    private double conflictThreshold = 0.5;

    // Weighted score above this makes a conflicting entity a manual-review candidate
    private double highRiskThreshold = 0.6;

    // Std dev of detector scores that counts as maximal disagreement
    private double sigmaMax = 0.5;

    // |z| at which the outlier score saturates at 1
    private double zScoreCap = 3.0;

    // Lower bounds of LOW, MEDIUM and HIGH
    private List<Double> riskBucketBounds = new ArrayList<>(List.of(0.4, 0.6, 0.8));

    private Dispatch dispatch = new Dispatch();

    private Insight insight = new Insight();

    @Data
    public static class Dispatch {
        private Duration detectorTimeout = Duration.ofSeconds(30);
        private int maxWorkers = 5;
    }

    @Data
    public static class Insight {
        // A detector whose HIGH count exceeds mean * factor is too sensitive, below mean / factor underperforming
        private double sensitivityFactor = 1.5;
        private int highRiskAlertCount = 10;
        private int mediumRiskAlertCount = 20;
        private int conflictAlertCount = 5;
        private int consistencyAlertCount = 10;
    }

    /**
     * Freezes the current values into an immutable, validated configuration for one run.
     * Runs against {@link #applyThresholds} and {@link #applyWeights}, so a run never sees half an update.
     */
    public synchronized RunConfiguration toRunConfiguration() {
        return RunConfiguration.builder()
                .weights(weights)
                .conflictThreshold(conflictThreshold)
                .highRiskThreshold(highRiskThreshold)
                .sigmaMax(sigmaMax)
                .zScoreCap(zScoreCap)
                .riskBucketBounds(riskBucketBounds == null ? null : Collections.unmodifiableList(new ArrayList<>(riskBucketBounds)))
                .detectorTimeout(dispatch.getDetectorTimeout())
                .maxWorkers(dispatch.getMaxWorkers())
                .sensitivityFactor(insight.getSensitivityFactor())
                .highRiskAlertCount(insight.getHighRiskAlertCount())
                .mediumRiskAlertCount(insight.getMediumRiskAlertCount())
                .conflictAlertCount(insight.getConflictAlertCount())
                .consistencyAlertCount(insight.getConsistencyAlertCount())
                .build()
                .validate();
    }

    public synchronized void applyWeights(Map<String, Double> newWeights) {
        this.weights = new LinkedHashMap<>(newWeights);
    }

    /**
     * Copies every scoring threshold of an already validated configuration in one step.
     */
    public synchronized void applyThresholds(RunConfiguration candidate) {
        this.conflictThreshold = candidate.getConflictThreshold();
        this.highRiskThreshold = candidate.getHighRiskThreshold();
        this.sigmaMax = candidate.getSigmaMax();
        this.zScoreCap = candidate.getZScoreCap();
        this.riskBucketBounds = new ArrayList<>(candidate.getRiskBucketBounds());
    }

    private static Map<String, Double> defaultWeights() {
        Map<String, Double> defaults = new LinkedHashMap<>();
        defaults.put("coverage_agent", 0.25);
        defaults.put("patient_flip_agent", 0.20);
        defaults.put("high_dollar_agent", 0.20);
        defaults.put("rejection_agent", 0.20);
        defaults.put("network_agent", 0.15);
        return defaults;
    }
}

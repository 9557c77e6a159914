package com.pharmacy.fraud.scoring;

import com.pharmacy.fraud.model.Finding;
import com.pharmacy.fraud.model.RunConfiguration;
import com.pharmacy.fraud.model.RunWarning;
import com.pharmacy.fraud.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Combines the findings of all successful detectors into one weighted score per pharmacy.
 *
 * weightedScore = Σ(weight × score) / Σ(weight), summed only over detectors that reported on the
 * pharmacy with a positive weight. A silent detector is not a zero score. Findings from zero-weight
 * detectors are left out entirely, so adding such a detector changes nothing.
 */
@Component
public class WeightedAggregator {

    private static final Logger log = LoggerFactory.getLogger(WeightedAggregator.class);

    public AggregationOutcome aggregate(SortedMap<String, List<Finding>> results, RunConfiguration config) {
        // entity -> detector -> finding, both levels sorted
        SortedMap<String, SortedMap<String, Finding>> byEntity = new TreeMap<>();
        for (Map.Entry<String, List<Finding>> entry : results.entrySet()) {
            for (Finding finding : entry.getValue()) {
                byEntity.computeIfAbsent(finding.getEntityId(), k -> new TreeMap<>())
                        .putIfAbsent(entry.getKey(), finding);
            }
        }

        SortedMap<String, PartialAggregate> partials = new TreeMap<>();
        List<RunWarning> warnings = new ArrayList<>();

        for (Map.Entry<String, SortedMap<String, Finding>> entry : byEntity.entrySet()) {
            String entityId = entry.getKey();
            SortedMap<String, Double> scores = new TreeMap<>();
            SortedMap<String, String> reasons = new TreeMap<>();
            double weightedSum = 0.0;
            double weightTotal = 0.0;

            for (Map.Entry<String, Finding> contribution : entry.getValue().entrySet()) {
                double weight = config.weightOf(contribution.getKey());
                if (weight <= 0.0) {
                    continue;
                }
                Finding finding = contribution.getValue();
                weightedSum += weight * finding.getScore();
                weightTotal += weight;
                scores.put(contribution.getKey(), finding.getScore());
                reasons.put(contribution.getKey(), finding.getReason());
            }

            if (weightTotal <= 0.0) {
                log.warn("Pharmacy {} excluded: all reporting detectors {} carry zero weight",
                        entityId, entry.getValue().keySet());
                warnings.add(RunWarning.of(WarningType.UNDETERMINED_AGGREGATE, null, entityId,
                        "All reporting detectors " + entry.getValue().keySet() + " carry zero weight"));
                continue;
            }

            double weightedScore = ScoreStatistics.clampUnit(weightedSum / weightTotal);
            partials.put(entityId, new PartialAggregate(entityId,
                    Collections.unmodifiableSortedMap(scores),
                    Collections.unmodifiableSortedMap(reasons),
                    weightedScore));
        }

        log.debug("Aggregated {} pharmacies from {} detectors ({} undetermined)",
                partials.size(), results.size(), warnings.size());
        return new AggregationOutcome(Collections.unmodifiableSortedMap(partials), List.copyOf(warnings));
    }
}

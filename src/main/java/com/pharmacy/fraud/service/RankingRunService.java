package com.pharmacy.fraud.service;

import com.pharmacy.fraud.config.MetricsConfig;
import com.pharmacy.fraud.config.ScoringProperties;
import com.pharmacy.fraud.engine.Detector;
import com.pharmacy.fraud.engine.DetectorDispatcher;
import com.pharmacy.fraud.engine.DetectorRegistry;
import com.pharmacy.fraud.engine.DispatchResult;
import com.pharmacy.fraud.engine.RunEventPublisher;
import com.pharmacy.fraud.model.AggregateResult;
import com.pharmacy.fraud.model.DatasetSnapshot;
import com.pharmacy.fraud.model.RankingRun;
import com.pharmacy.fraud.model.RiskLevel;
import com.pharmacy.fraud.model.RunConfiguration;
import com.pharmacy.fraud.model.RunSummary;
import com.pharmacy.fraud.model.RunWarning;
import com.pharmacy.fraud.model.WarningType;
import com.pharmacy.fraud.scoring.AggregationOutcome;
import com.pharmacy.fraud.scoring.ConsistencyAnalyzer;
import com.pharmacy.fraud.scoring.OutlierAnalyzer;
import com.pharmacy.fraud.scoring.OutlierAssessment;
import com.pharmacy.fraud.scoring.PartialAggregate;
import com.pharmacy.fraud.scoring.WeightedAggregator;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Main orchestrator for a ranking run.
 *
 * Flow:
 * 1. Freeze and validate the run configuration (fails before anything runs)
 * 2. Dispatch all detectors in parallel and wait for every one of them
 * 3. Aggregate findings into weighted scores per pharmacy
 * 4. Compute consistency and population outlier scores
 * 5. Compose final scores, classify and rank
 * 6. Summarize detector behavior and review candidates
 *
 * Holds no state between runs; every run is a function of snapshot, detectors and configuration.
 */
@Service
public class RankingRunService {

    private static final Logger log = LoggerFactory.getLogger(RankingRunService.class);

    private final DetectorRegistry detectorRegistry;
    private final ScoringProperties scoringProperties;
    private final DetectorDispatcher dispatcher;
    private final WeightedAggregator aggregator;
    private final ConsistencyAnalyzer consistencyAnalyzer;
    private final OutlierAnalyzer outlierAnalyzer;
    private final RiskScoringService riskScoringService;
    private final InsightService insightService;
    private final RunEventPublisher eventPublisher;
    private final MetricsConfig metricsConfig;

    public RankingRunService(DetectorRegistry detectorRegistry,
                             ScoringProperties scoringProperties,
                             DetectorDispatcher dispatcher,
                             WeightedAggregator aggregator,
                             ConsistencyAnalyzer consistencyAnalyzer,
                             OutlierAnalyzer outlierAnalyzer,
                             RiskScoringService riskScoringService,
                             InsightService insightService,
                             RunEventPublisher eventPublisher,
                             MetricsConfig metricsConfig) {
        this.detectorRegistry = detectorRegistry;
        this.scoringProperties = scoringProperties;
        this.dispatcher = dispatcher;
        this.aggregator = aggregator;
        this.consistencyAnalyzer = consistencyAnalyzer;
        this.outlierAnalyzer = outlierAnalyzer;
        this.riskScoringService = riskScoringService;
        this.insightService = insightService;
        this.eventPublisher = eventPublisher;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Run every registered detector over the snapshot with the current configuration.
     * This is the main entry point called by the REST controller.
     */
    @Observed(name = "ranking.run", contextualName = "rank-pharmacies")
    public RankingRun run(DatasetSnapshot snapshot) {
        return run(snapshot, detectorRegistry.getDetectors(), scoringProperties.toRunConfiguration());
    }

    public RankingRun run(DatasetSnapshot snapshot, List<? extends Detector> detectors, RunConfiguration config) {
        config.validate();
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        log.info("Run {} started: {} detectors, snapshot {} ({} claims)",
                runId, detectors.size(), snapshot.getSnapshotId(), snapshot.size());

        DispatchResult dispatch = dispatcher.dispatch(runId, snapshot, detectors, config);
        return score(runId, snapshot.getSnapshotId(), startedAt, dispatch, config);
    }

    /**
     * Score pre-computed detector output with the current configuration. No detector is invoked.
     */
    public RankingRun aggregate(DispatchResult dispatch) {
        return aggregate(dispatch, scoringProperties.toRunConfiguration());
    }

    public RankingRun aggregate(DispatchResult dispatch, RunConfiguration config) {
        config.validate();
        return score(UUID.randomUUID().toString(), null, Instant.now(), dispatch, config);
    }

    public List<String> getDetectorNames() {
        return detectorRegistry.getDetectorNames();
    }

    private RankingRun score(String runId, String snapshotId, Instant startedAt,
                             DispatchResult dispatch, RunConfiguration config) {
        List<RunWarning> warnings = new ArrayList<>(dispatch.getWarnings());

        // 3. Weighted aggregation
        AggregationOutcome aggregation = aggregator.aggregate(dispatch.getResults(), config);
        warnings.addAll(aggregation.getWarnings());
        SortedMap<String, PartialAggregate> partials = aggregation.getPartials();

        // 4. Consistency per pharmacy, outliers over the whole population
        SortedMap<String, Double> weightedScores = new TreeMap<>();
        partials.forEach((id, partial) -> weightedScores.put(id, partial.getWeightedScore()));
        if (weightedScores.size() < 2) {
            warnings.add(RunWarning.of(WarningType.EMPTY_POPULATION, null, null,
                    "Only " + weightedScores.size() + " pharmacies scored; outlier scores are neutral"));
        }
        SortedMap<String, OutlierAssessment> outliers = outlierAnalyzer.assess(weightedScores, config);

        // 5. Compose, classify, rank
        List<AggregateResult> unranked = new ArrayList<>(partials.size());
        for (PartialAggregate partial : partials.values()) {
            double consistency = consistencyAnalyzer.consistency(partial.getPerDetectorScores(), config);
            unranked.add(riskScoringService.compose(partial, consistency, outliers.get(partial.getEntityId()), config));
        }
        List<AggregateResult> ranked = riskScoringService.rank(unranked);

        // 6. Summary
        RunSummary summary = insightService.summarize(dispatch, ranked, warnings, config);

        ranked.forEach(r -> metricsConfig.recordRiskLevel(r.getRiskLevel(), r.getFinalScore()));
        metricsConfig.updateManualReviewCount(summary.getManualReviewEntityIds().size());
        eventPublisher.aggregationCompleted(runId, ranked.size(), dispatch.getFailures().size());

        if (!dispatch.getFailures().isEmpty() || !warnings.isEmpty()) {
            log.warn("Run {} degraded: failed detectors={}, warnings={}",
                    runId, dispatch.getFailures().keySet(), warnings.size());
        }
        log.info("Run {} completed: {} pharmacies ranked, {} HIGH, {} flagged for manual review",
                runId, ranked.size(), summary.getRiskLevelCounts().get(RiskLevel.HIGH),
                summary.getManualReviewEntityIds().size());

        return RankingRun.builder()
                .runId(runId)
                .snapshotId(snapshotId)
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .results(ranked)
                .summary(summary)
                .build();
    }
}

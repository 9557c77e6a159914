package com.pharmacy.fraud.config;

import com.pharmacy.fraud.model.RiskLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger lastRunReviewCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastRunReviewCount = registry.gauge("ranking.manual_review.entities", new AtomicInteger(0));
    }

    public void recordDetectorOutcome(String detectorName, String outcome, Duration elapsed) {
        Timer.builder("detector.run.duration")
                .tag("detector", detectorName)
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsed);
    }

    public void recordRun(String outcome, int rankedEntities) {
        Counter.builder("ranking.run.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("ranking.run.entities")
                .register(registry)
                .record(rankedEntities);
    }

    public void recordRiskLevel(RiskLevel level, double finalScore) {
        DistributionSummary.builder("ranking.final_score")
                .tag("risk_level", level.name())
                .register(registry)
                .record(finalScore);
    }

    public void updateManualReviewCount(int count) {
        lastRunReviewCount.set(count);
    }
}

package com.pharmacy.fraud.engine;

import com.pharmacy.fraud.config.MetricsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Turns run events into Micrometer meters and log lines.
 */
@Component
public class MetricsRunEventSink implements RunEventSink {

    private static final Logger log = LoggerFactory.getLogger(MetricsRunEventSink.class);

    private final MetricsConfig metricsConfig;

    public MetricsRunEventSink(MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
    }

    @Override
    public void onDispatchStarted(String runId, List<String> detectorNames) {
        log.debug("Run {}: dispatch started for {}", runId, detectorNames);
    }

    @Override
    public void onDetectorCompleted(DetectorRunEvent event) {
        String outcome = event.isSucceeded() || event.getFailureReason() == null
                ? "success"
                : event.getFailureReason().name().toLowerCase(Locale.ROOT);
        metricsConfig.recordDetectorOutcome(event.getDetectorName(), outcome, event.getElapsed());
        log.debug("Run {}: detector {} finished ({}) with {} findings in {} ms",
                event.getRunId(), event.getDetectorName(), outcome, event.getFindingCount(),
                event.getElapsed().toMillis());
    }

    @Override
    public void onAggregationCompleted(String runId, int rankedEntities, int failedDetectors) {
        metricsConfig.recordRun(failedDetectors == 0 ? "complete" : "degraded", rankedEntities);
    }
}

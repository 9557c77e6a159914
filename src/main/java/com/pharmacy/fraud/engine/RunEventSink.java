package com.pharmacy.fraud.engine;

import java.util.List;

/**
 * Optional receiver of structured run events. Sinks observe a run but never influence it.
 * Per-detector events arrive on worker threads, so implementations must be thread-safe.
 */
public interface RunEventSink {

    default void onDispatchStarted(String runId, List<String> detectorNames) {
    }

    default void onDetectorCompleted(DetectorRunEvent event) {
    }

    default void onAggregationCompleted(String runId, int rankedEntities, int failedDetectors) {
    }
}

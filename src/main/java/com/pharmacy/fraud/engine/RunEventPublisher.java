package com.pharmacy.fraud.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans run events out to every registered {@link RunEventSink}.
 * A failing sink is logged and skipped; it never reaches the run.
 */
@Component
public class RunEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RunEventPublisher.class);

    private final List<RunEventSink> sinks;

    @Autowired
    public RunEventPublisher(ObjectProvider<RunEventSink> sinks) {
        this(sinks.orderedStream().toList());
    }

    public RunEventPublisher(List<RunEventSink> sinks) {
        this.sinks = List.copyOf(sinks);
        log.info("Registered {} run event sink(s)", this.sinks.size());
    }

    public static RunEventPublisher none() {
        return new RunEventPublisher(List.of());
    }

    public void dispatchStarted(String runId, List<String> detectorNames) {
        publish("dispatch-started", sink -> sink.onDispatchStarted(runId, detectorNames));
    }

    public void detectorCompleted(DetectorRunEvent event) {
        publish("detector-completed", sink -> sink.onDetectorCompleted(event));
    }

    public void aggregationCompleted(String runId, int rankedEntities, int failedDetectors) {
        publish("aggregation-completed", sink -> sink.onAggregationCompleted(runId, rankedEntities, failedDetectors));
    }

    private void publish(String eventName, Consumer<RunEventSink> delivery) {
        for (RunEventSink sink : sinks) {
            try {
                delivery.accept(sink);
            } catch (RuntimeException e) {
                log.warn("Run event sink {} failed on {}: {}",
                        sink.getClass().getSimpleName(), eventName, e.getMessage(), e);
            }
        }
    }
}

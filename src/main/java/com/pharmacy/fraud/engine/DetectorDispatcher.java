package com.pharmacy.fraud.engine;

import com.pharmacy.fraud.exception.ConfigurationException;
import com.pharmacy.fraud.exception.RunCancelledException;
import com.pharmacy.fraud.model.DatasetSnapshot;
import com.pharmacy.fraud.model.DetectorFailure;
import com.pharmacy.fraud.model.FailureReason;
import com.pharmacy.fraud.model.Finding;
import com.pharmacy.fraud.model.RunConfiguration;
import com.pharmacy.fraud.model.RunWarning;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs every detector of a run concurrently against the same snapshot and waits for all of them.
 *
 * At most min(detectors, maxWorkers) detectors run at once. A watchdog thread enforces the
 * per-detector timeout from the moment a detector starts; a timed-out detector gives its slot back
 * immediately, even when its thread ignores the interrupt, so it never holds up queued detectors.
 * Findings are validated on the worker, and a failing, timed-out or invalid detector is recorded and
 * excluded. Results are keyed by detector name, so completion order has no influence on the outcome.
 */
@Component
public class DetectorDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DetectorDispatcher.class);

    private final Tracer tracer;
    private final RunEventPublisher eventPublisher;
    private final FindingValidator findingValidator;

    @Autowired
    public DetectorDispatcher(ObjectProvider<Tracer> tracer, RunEventPublisher eventPublisher,
                              FindingValidator findingValidator) {
        this(tracer.getIfAvailable(() -> Tracer.NOOP), eventPublisher, findingValidator);
    }

    public DetectorDispatcher(Tracer tracer, RunEventPublisher eventPublisher, FindingValidator findingValidator) {
        this.tracer = tracer;
        this.eventPublisher = eventPublisher;
        this.findingValidator = findingValidator;
    }

    /**
     * Dispatch all detectors and block until each one has completed, failed or timed out.
     *
     * @throws ConfigurationException if a detector name is blank or used twice
     * @throws RunCancelledException  if the calling thread is interrupted while waiting
     */
    public DispatchResult dispatch(String runId, DatasetSnapshot snapshot,
                                   List<? extends Detector> detectors, RunConfiguration config) {
        List<Detector> ordered = checkedInNameOrder(detectors);
        if (ordered.isEmpty()) {
            log.warn("Run {}: no detectors registered, nothing to dispatch", runId);
            return DispatchResult.empty();
        }

        List<String> names = ordered.stream().map(Detector::getName).toList();
        eventPublisher.dispatchStarted(runId, names);

        int poolSize = Math.min(ordered.size(), config.getMaxWorkers());
        log.info("Run {}: dispatching {} detectors on {} worker(s) over {} claims",
                runId, ordered.size(), poolSize, snapshot.size());

        Semaphore slots = new Semaphore(poolSize, true);
        ExecutorService workers = Executors.newCachedThreadPool(daemonThreads("detector-"));
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(
                daemonThreads("detector-watchdog-"));
        Span parent = tracer.currentSpan();
        try {
            SortedMap<String, CompletableFuture<FindingValidator.Validation>> pending = new TreeMap<>();
            for (Detector detector : ordered) {
                pending.put(detector.getName(), submit(runId, detector, snapshot, config.getDetectorTimeout(),
                        slots, workers, watchdog, parent));
            }
            return collect(runId, pending, config.getDetectorTimeout());
        } finally {
            workers.shutdownNow();
            watchdog.shutdownNow();
        }
    }

    private CompletableFuture<FindingValidator.Validation> submit(String runId, Detector detector,
                                                                  DatasetSnapshot snapshot, Duration timeout,
                                                                  Semaphore slots, ExecutorService workers,
                                                                  ScheduledExecutorService watchdog, Span parent) {
        String name = detector.getName();
        CompletableFuture<FindingValidator.Validation> outcome = new CompletableFuture<>();
        AtomicLong startedAt = new AtomicLong(System.nanoTime());
        AtomicBoolean holdsSlot = new AtomicBoolean(false);
        Runnable releaseSlot = () -> {
            if (holdsSlot.compareAndSet(true, false)) {
                slots.release();
            }
        };

        Future<?> task = workers.submit(() -> {
            try {
                slots.acquire();
            } catch (InterruptedException e) {
                outcome.completeExceptionally(e);
                Thread.currentThread().interrupt();
                return;
            }
            holdsSlot.set(true);
            if (outcome.isDone()) {
                releaseSlot.run();
                return;
            }

            startedAt.set(System.nanoTime());
            Span span = tracer.nextSpan(parent)
                    .name("detector.run")
                    .tag("detector.name", name)
                    .tag("run.id", runId)
                    .start();
            ScheduledFuture<?> timer = null;
            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                timer = watchdog.schedule(() -> outcome.completeExceptionally(new TimeoutException(
                                "Detector exceeded timeout of " + timeout.toMillis() + " ms")),
                        timeout.toMillis(), TimeUnit.MILLISECONDS);
                FindingValidator.Validation validation = findingValidator.validate(name, detector.detect(snapshot));
                outcome.complete(validation);
                span.tag("detector.findings", String.valueOf(validation.getAccepted().size()));
            } catch (Exception e) {
                span.error(e);
                outcome.completeExceptionally(e);
            } finally {
                if (timer != null) {
                    timer.cancel(false);
                }
                if (!outcome.isDone()) {
                    outcome.completeExceptionally(new IllegalStateException("Detector terminated abnormally"));
                }
                releaseSlot.run();
                span.end();
            }
        });

        outcome.whenComplete((validation, error) -> {
            if (error instanceof TimeoutException) {
                task.cancel(true);
                releaseSlot.run();
            }
            boolean failed = error != null || validation.isFailed();
            eventPublisher.detectorCompleted(DetectorRunEvent.builder()
                    .runId(runId)
                    .detectorName(name)
                    .succeeded(!failed)
                    .failureReason(error != null ? classify(error)
                            : failed ? validation.getFailure().getReason() : null)
                    .findingCount(failed ? 0 : validation.getAccepted().size())
                    .elapsed(Duration.ofNanos(System.nanoTime() - startedAt.get()))
                    .build());
        });
        return outcome;
    }

    private DispatchResult collect(String runId,
                                   SortedMap<String, CompletableFuture<FindingValidator.Validation>> pending,
                                   Duration timeout) {
        SortedMap<String, List<Finding>> results = new TreeMap<>();
        SortedMap<String, DetectorFailure> failures = new TreeMap<>();
        List<RunWarning> warnings = new ArrayList<>();

        for (Map.Entry<String, CompletableFuture<FindingValidator.Validation>> entry : pending.entrySet()) {
            String name = entry.getKey();
            try {
                FindingValidator.Validation validation = entry.getValue().get();
                warnings.addAll(validation.getWarnings());
                if (validation.isFailed()) {
                    log.warn("Run {}: detector {} failed, {}", runId, name, validation.getFailure().getMessage());
                    failures.put(name, validation.getFailure());
                } else {
                    results.put(name, validation.getAccepted());
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof TimeoutException) {
                    log.warn("Run {}: detector {} timed out after {} ms", runId, name, timeout.toMillis());
                    failures.put(name, failure(name, FailureReason.TIMEOUT, cause.getMessage()));
                } else {
                    log.error("Run {}: detector {} failed: {}", runId, name, cause.getMessage(), cause);
                    failures.put(name, failure(name, FailureReason.ERROR,
                            cause.getClass().getSimpleName() + ": " + cause.getMessage()));
                }
            } catch (InterruptedException e) {
                pending.values().forEach(future -> future.cancel(true));
                Thread.currentThread().interrupt();
                throw new RunCancelledException("Run " + runId + " was cancelled while waiting for detectors", e);
            }
        }

        log.info("Run {}: dispatch finished, {} detector(s) succeeded, {} failed",
                runId, results.size(), failures.size());
        return new DispatchResult(results, failures, warnings);
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    private static List<Detector> checkedInNameOrder(List<? extends Detector> detectors) {
        Set<String> names = new HashSet<>();
        List<Detector> ordered = new ArrayList<>(detectors.size());
        for (Detector detector : detectors) {
            if (detector == null || detector.getName() == null || detector.getName().isBlank()) {
                throw new ConfigurationException("detectors", "Every detector needs a non-blank name");
            }
            if (!names.add(detector.getName())) {
                throw new ConfigurationException("detectors", "Duplicate detector name: " + detector.getName());
            }
            ordered.add(detector);
        }
        ordered.sort(Comparator.comparing(Detector::getName));
        return ordered;
    }

    private static FailureReason classify(Throwable error) {
        return error instanceof TimeoutException ? FailureReason.TIMEOUT : FailureReason.ERROR;
    }

    private static DetectorFailure failure(String name, FailureReason reason, String message) {
        return DetectorFailure.builder()
                .detectorName(name)
                .reason(reason)
                .message(message)
                .build();
    }
}

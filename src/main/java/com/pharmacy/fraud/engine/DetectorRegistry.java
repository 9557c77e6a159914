package com.pharmacy.fraud.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * The fixed set of detectors known at startup. Every {@link Detector} bean is registered automatically.
 */
@Component
public class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final List<Detector> detectors;

    @Autowired
    public DetectorRegistry(ObjectProvider<Detector> detectors) {
        this(detectors.orderedStream().toList());
    }

    public DetectorRegistry(List<Detector> detectors) {
        this.detectors = detectors.stream()
                .sorted(Comparator.comparing(Detector::getName, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();

        for (Detector detector : this.detectors) {
            log.info("Registered detector: {} -> {}", detector.getName(), detector.getClass().getSimpleName());
        }
        if (this.detectors.isEmpty()) {
            log.warn("No detectors registered; ranking runs will only accept pre-computed findings");
        }
    }

    public List<Detector> getDetectors() {
        return detectors;
    }

    public List<String> getDetectorNames() {
        return detectors.stream().map(Detector::getName).toList();
    }
}

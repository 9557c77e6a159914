package com.pharmacy.fraud.engine;

import com.pharmacy.fraud.exception.ConfigurationException;
import com.pharmacy.fraud.model.DetectorFailure;
import com.pharmacy.fraud.model.FailureReason;
import com.pharmacy.fraud.model.Finding;
import com.pharmacy.fraud.model.RunWarning;
import com.pharmacy.fraud.model.WarningType;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Applies the finding contract to one detector's output.
 *
 * Invalid findings are dropped with a warning. The first finding per pharmacy wins, later ones are
 * dropped as duplicates. A detector whose findings are all invalid, or that returns no list at all,
 * is treated as failed.
 */
@Component
public class FindingValidator {

    private static final Logger log = LoggerFactory.getLogger(FindingValidator.class);

    @Value
    public static class Validation {
        List<Finding> accepted;
        List<RunWarning> warnings;
        DetectorFailure failure;    // null unless every finding was invalid

        public boolean isFailed() {
            return failure != null;
        }
    }

    public Validation validate(String detectorName, List<Finding> raw) {
        if (raw == null) {
            DetectorFailure failure = DetectorFailure.builder()
                    .detectorName(detectorName)
                    .reason(FailureReason.ERROR)
                    .message("Detector returned no finding list")
                    .build();
            return new Validation(List.of(), List.of(), failure);
        }
        List<Finding> accepted = new ArrayList<>(raw.size());
        List<RunWarning> warnings = new ArrayList<>();
        Set<String> seenEntities = new HashSet<>();
        int invalid = 0;

        for (Finding finding : raw) {
            if (finding == null || !finding.isWellFormed() || !detectorName.equals(finding.getDetectorName())) {
                invalid++;
                warnings.add(RunWarning.of(WarningType.INVALID_FINDING, detectorName,
                        finding == null ? null : finding.getEntityId(), describeInvalid(detectorName, finding)));
                continue;
            }
            if (!seenEntities.add(finding.getEntityId())) {
                warnings.add(RunWarning.of(WarningType.DUPLICATE_FINDING, detectorName, finding.getEntityId(),
                        "Additional finding for the same pharmacy ignored"));
                continue;
            }
            accepted.add(finding);
        }

        if (invalid > 0) {
            log.warn("Detector {} returned {} invalid finding(s) out of {}", detectorName, invalid, raw.size());
        }
        if (!raw.isEmpty() && invalid == raw.size()) {
            DetectorFailure failure = DetectorFailure.builder()
                    .detectorName(detectorName)
                    .reason(FailureReason.INVALID_OUTPUT)
                    .message("All " + raw.size() + " findings were invalid")
                    .build();
            return new Validation(List.of(), List.copyOf(warnings), failure);
        }
        return new Validation(List.copyOf(accepted), List.copyOf(warnings), null);
    }

    /**
     * Build a dispatch result from detector output produced elsewhere, applying the same contract a
     * live dispatch applies. Detectors listed in {@code failures} are recorded as errors.
     */
    public DispatchResult toDispatchResult(Map<String, List<Finding>> findings, Map<String, String> failures) {
        SortedMap<String, List<Finding>> results = new TreeMap<>();
        SortedMap<String, DetectorFailure> failed = new TreeMap<>();
        List<RunWarning> warnings = new ArrayList<>();

        new TreeMap<>(failures).forEach((name, message) -> failed.put(name, DetectorFailure.builder()
                .detectorName(name)
                .reason(FailureReason.ERROR)
                .message(message)
                .build()));

        for (Map.Entry<String, List<Finding>> entry : new TreeMap<>(findings).entrySet()) {
            String name = entry.getKey();
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("findings", "Detector name must not be blank");
            }
            if (failed.containsKey(name)) {
                throw new ConfigurationException("findings", "Detector " + name + " is reported both with findings and as failed");
            }
            Validation validation = validate(name, entry.getValue() == null ? List.of() : entry.getValue());
            warnings.addAll(validation.getWarnings());
            if (validation.isFailed()) {
                failed.put(name, validation.getFailure());
            } else {
                results.put(name, validation.getAccepted());
            }
        }
        return new DispatchResult(results, failed, warnings);
    }

    private static String describeInvalid(String detectorName, Finding finding) {
        if (finding == null) {
            return "Null finding";
        }
        if (finding.getEntityId() == null || finding.getEntityId().isBlank()) {
            return "Finding without entity id";
        }
        if (finding.getDetectorName() == null || !detectorName.equals(finding.getDetectorName())) {
            return "Finding attributed to '" + finding.getDetectorName() + "' instead of '" + detectorName + "'";
        }
        return "Score " + finding.getScore() + " outside [0, 1]";
    }
}

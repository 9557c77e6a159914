package com.pharmacy.fraud.engine;

import com.pharmacy.fraud.model.DetectorFailure;
import com.pharmacy.fraud.model.Finding;
import com.pharmacy.fraud.model.RunWarning;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Findings and failures of one dispatch, keyed by detector name.
 * A detector appears in exactly one of the two maps.
 */
@Value
public class DispatchResult {

    SortedMap<String, List<Finding>> results;
    SortedMap<String, DetectorFailure> failures;
    List<RunWarning> warnings;

    public DispatchResult(SortedMap<String, List<Finding>> results,
                          SortedMap<String, DetectorFailure> failures,
                          List<RunWarning> warnings) {
        this.results = Collections.unmodifiableSortedMap(new TreeMap<>(results));
        this.failures = Collections.unmodifiableSortedMap(new TreeMap<>(failures));
        this.warnings = List.copyOf(warnings);
    }

    public static DispatchResult empty() {
        return new DispatchResult(new TreeMap<>(), new TreeMap<>(), List.of());
    }

    public int totalFindings() {
        return results.values().stream().mapToInt(List::size).sum();
    }
}

package com.pharmacy.fraud.engine;

import com.pharmacy.fraud.model.FailureReason;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class DetectorRunEvent {
    String runId;
    String detectorName;
    boolean succeeded;
    FailureReason failureReason;    // null when succeeded
    int findingCount;               // accepted findings, after validation
    Duration elapsed;
}

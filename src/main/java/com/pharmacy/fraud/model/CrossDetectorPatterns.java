package com.pharmacy.fraud.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CrossDetectorPatterns {
    int conflictingSignals;     // one detector HIGH while another is below the LOW bound
    int highConsistency;        // three or more detectors agreeing at either extreme
    int corroboratedHighRisk;   // two or more detectors HIGH, possible double counting
}

package com.pharmacy.fraud.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DetectorPerformance {
    String detectorName;
    double averageScore;
    int highRiskFindings;       // findings at or above the HIGH bound
    int totalFindings;
    DetectorAssessment assessment;
}

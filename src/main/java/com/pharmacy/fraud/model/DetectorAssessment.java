package com.pharmacy.fraud.model;

public enum DetectorAssessment {
    NORMAL,
    TOO_SENSITIVE,
    UNDERPERFORMING,
    FAILED
}

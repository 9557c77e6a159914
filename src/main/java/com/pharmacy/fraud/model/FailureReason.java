package com.pharmacy.fraud.model;

public enum FailureReason {
    ERROR,
    TIMEOUT,
    INVALID_OUTPUT
}

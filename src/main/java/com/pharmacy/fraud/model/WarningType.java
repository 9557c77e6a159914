package com.pharmacy.fraud.model;

public enum WarningType {
    INVALID_FINDING,
    DUPLICATE_FINDING,
    UNDETERMINED_AGGREGATE,
    EMPTY_POPULATION
}

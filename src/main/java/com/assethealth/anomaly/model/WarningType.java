package com.assethealth.anomaly.model;

public enum WarningType {
    DEGENERATE_FEATURE,
    TRAINING_ANOMALY,
    IRREGULAR_SPACING,
    NON_NUMERIC_COLUMN
}

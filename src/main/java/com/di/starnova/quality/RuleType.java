package com.di.starnova.quality;

public enum RuleType {
    KEY_INTEGRITY,
    REFERENTIAL_INTEGRITY,
    ACCEPTED_VALUES,
    NUMERIC_RANGE
}

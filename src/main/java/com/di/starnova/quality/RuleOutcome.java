package com.di.starnova.quality;

public enum RuleOutcome {
    PASS,
    FAIL
}

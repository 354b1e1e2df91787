package com.tournament.analytics.domain.model;

public enum Confidence {
    HIGH,
    MEDIUM,
    LOW
}

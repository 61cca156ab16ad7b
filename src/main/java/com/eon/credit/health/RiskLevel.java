package com.eon.credit.health;

public enum RiskLevel {
    SAFE,
    WARNING,
    DANGER,
    CRITICAL
}

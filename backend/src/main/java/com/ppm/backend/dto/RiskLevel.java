package com.ppm.backend.dto;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}

package com.adpanel.entity;

public enum OptimizationStatus {
    COMPLETED,
    SKIPPED,
    FAILED,
    APPLIED
}

package com.adpanel.entity;

public enum TaskStatus {
    RUNNING,
    COMPLETED,
    FAILED
}

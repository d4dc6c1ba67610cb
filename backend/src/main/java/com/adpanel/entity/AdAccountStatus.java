package com.adpanel.entity;

public enum AdAccountStatus {
    ACTIVE,
    DISABLED
}

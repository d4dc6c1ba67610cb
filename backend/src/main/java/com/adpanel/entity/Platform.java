package com.adpanel.entity;

public enum Platform {
    TIKTOK,
    FACEBOOK,
    INSTAGRAM
}

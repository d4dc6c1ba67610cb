package com.adpanel.entity;

/**
 * Managed category of an ad, inferred from naming tokens. GENERAL covers ads created directly on
 * the platform outside the naming convention.
 */
public enum AdCategory {
    ABX,
    ACE,
    GENERAL
}

package com.adpanel.dto.platform;

/** A typed row parsed from a platform list response. */
public interface PlatformRecord {

    String externalId();
}

package com.adpanel.dto.platform;

import java.math.BigDecimal;

/** Lifetime spend of one ad. */
public record AdSpend(String externalId, BigDecimal spend) implements PlatformRecord {}

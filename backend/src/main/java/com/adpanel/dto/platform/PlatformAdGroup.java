package com.adpanel.dto.platform;

import java.math.BigDecimal;

public record PlatformAdGroup(
        String externalId,
        String campaignId,
        String name,
        String status,
        String optimizationGoal,
        String budgetMode,
        BigDecimal budget)
        implements PlatformRecord {}

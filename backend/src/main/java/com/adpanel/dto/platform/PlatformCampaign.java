package com.adpanel.dto.platform;

import java.math.BigDecimal;

public record PlatformCampaign(
        String externalId,
        String name,
        String status,
        String objective,
        String budgetMode,
        BigDecimal budget)
        implements PlatformRecord {}

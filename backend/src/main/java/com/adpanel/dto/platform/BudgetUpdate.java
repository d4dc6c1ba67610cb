package com.adpanel.dto.platform;

import java.math.BigDecimal;

public record BudgetUpdate(String adGroupId, BigDecimal budget) {}

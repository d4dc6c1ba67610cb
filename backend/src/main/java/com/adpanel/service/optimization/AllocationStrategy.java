package com.adpanel.service.optimization;

import com.adpanel.dto.optimization.AllocationOutcome;
import com.adpanel.entity.AllocationStrategyType;
import com.adpanel.entity.DailyBudgetAllocation;
import java.math.BigDecimal;

/** Splits one day's envelope of one product group over targets. Computes only, never writes. */
public interface AllocationStrategy {

    AllocationStrategyType type();

    AllocationOutcome allocate(DailyBudgetAllocation dailyBudget, BigDecimal envelope);
}

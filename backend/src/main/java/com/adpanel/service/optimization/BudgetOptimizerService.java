package com.adpanel.service.optimization;

import com.adpanel.dto.optimization.AllocationOutcome;
import com.adpanel.dto.task.JobReport;
import com.adpanel.entity.AllocationStrategyType;
import com.adpanel.entity.BudgetAllocation;
import com.adpanel.entity.BudgetPlan;
import com.adpanel.entity.DailyBudgetAllocation;
import com.adpanel.entity.OptimizationLog;
import com.adpanel.entity.OptimizationStatus;
import com.adpanel.repository.jpa.DailyBudgetAllocationRepository;
import com.adpanel.repository.jpa.OptimizationLogRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the plan's strategy over each of the day's budget rows and records the result as an
 * optimization log. Nothing is sent to a platform here; see {@link AllocationActuator}.
 */
@Slf4j
@Service
public class BudgetOptimizerService {

    private final DailyBudgetAllocationRepository dailyBudgetAllocationRepository;
    private final OptimizationLogRepository optimizationLogRepository;
    private final Map<AllocationStrategyType, AllocationStrategy> strategies;

    public BudgetOptimizerService(
            DailyBudgetAllocationRepository dailyBudgetAllocationRepository,
            OptimizationLogRepository optimizationLogRepository,
            List<AllocationStrategy> strategies) {
        this.dailyBudgetAllocationRepository = dailyBudgetAllocationRepository;
        this.optimizationLogRepository = optimizationLogRepository;
        this.strategies = new EnumMap<>(AllocationStrategyType.class);
        strategies.forEach(s -> this.strategies.put(s.type(), s));
    }

    public JobReport optimize(LocalDate date) {
        List<DailyBudgetAllocation> rows = dailyBudgetAllocationRepository.findByBudgetDateWithPlan(date);

        int processed = 0;
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (DailyBudgetAllocation row : rows) {
            BudgetAllocation allocation = row.getBudgetAllocation();
            BudgetPlan plan = allocation.getBudgetPlan();
            if (!Boolean.TRUE.equals(plan.getActive())
                    || Boolean.TRUE.equals(row.getLocked())
                    || Boolean.TRUE.equals(allocation.getLocked())
                    || row.isProcessedFor(plan.getStrategy())) {
                skipped++;
                continue;
            }

            processed++;
            OptimizationLog entry = optimizeRow(row);
            if (entry.getStatus() == OptimizationStatus.FAILED) {
                failed++;
            } else {
                succeeded++;
            }
        }

        return JobReport.of(
                processed, succeeded, failed, "Rows skipped (locked or already processed): " + skipped);
    }

    /**
     * Allocates one row and writes its log. The row is marked processed only after the log is
     * stored, and only when there was something to allocate.
     */
    OptimizationLog optimizeRow(DailyBudgetAllocation row) {
        BudgetAllocation allocation = row.getBudgetAllocation();
        AllocationStrategyType strategyType = allocation.getBudgetPlan().getStrategy();
        BigDecimal envelope = row.remainingEnvelope();

        OptimizationLog.OptimizationLogBuilder entry =
                OptimizationLog.builder()
                        .budgetPlanId(allocation.getBudgetPlan().getId())
                        .budgetAllocationId(allocation.getId())
                        .dailyBudgetId(row.getId())
                        .budgetDate(row.getBudgetDate())
                        .strategy(strategyType)
                        .envelope(envelope);

        try {
            AllocationStrategy strategy = strategies.get(strategyType);
            if (strategy == null) {
                throw new IllegalStateException("No allocation strategy for " + strategyType);
            }
            if (envelope.signum() == 0) {
                return optimizationLogRepository.save(
                        entry.status(OptimizationStatus.SKIPPED)
                                .totalAllocated(BigDecimal.ZERO)
                                .changesMade(0)
                                .reason("Nothing left of the day's planned budget")
                                .build());
            }

            AllocationOutcome outcome = strategy.allocate(row, envelope);
            if (!outcome.getDiscarded().isEmpty()) {
                log.warn(
                        "Row {}: {} targets under the minimum spend floor dropped without redistribution",
                        row.getId(),
                        outcome.getDiscarded().size());
            }

            OptimizationLog saved =
                    optimizationLogRepository.save(
                            entry.status(
                                            outcome.hasDecisions()
                                                    ? OptimizationStatus.COMPLETED
                                                    : OptimizationStatus.SKIPPED)
                                    .totalAllocated(outcome.getTotalAllocated())
                                    .changesMade(outcome.getDecisions().size())
                                    .decisions(outcome.getDecisions())
                                    .discarded(outcome.getDiscarded())
                                    .reason(outcome.getReason())
                                    .build());

            if (outcome.hasDecisions()) {
                row.markProcessed(strategyType);
                dailyBudgetAllocationRepository.save(row);
            }
            log.info(
                    "Row {} ({}): {} of {} allocated to {} targets",
                    row.getId(),
                    strategyType,
                    saved.getTotalAllocated(),
                    envelope,
                    saved.getChangesMade());
            return saved;
        } catch (Exception e) {
            log.error("Optimization failed for row {}: {}", row.getId(), e.getMessage(), e);
            return optimizationLogRepository.save(
                    entry.status(OptimizationStatus.FAILED)
                            .totalAllocated(BigDecimal.ZERO)
                            .changesMade(0)
                            .reason(e.getMessage())
                            .build());
        }
    }
}

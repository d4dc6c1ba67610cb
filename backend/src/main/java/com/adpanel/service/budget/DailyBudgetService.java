package com.adpanel.service.budget;

import com.adpanel.dto.task.JobReport;
import com.adpanel.entity.BudgetAllocation;
import com.adpanel.entity.BudgetPlan;
import com.adpanel.entity.DailyBudgetAllocation;
import com.adpanel.repository.jpa.BudgetAllocationRepository;
import com.adpanel.repository.jpa.BudgetPlanRepository;
import com.adpanel.repository.jpa.DailyBudgetAllocationRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Splits each allocation's remaining budget over the remaining days of its plan and books spend
 * growth against the day's rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailyBudgetService {

    private static final int MONEY_SCALE = 2;

    private final BudgetPlanRepository budgetPlanRepository;
    private final BudgetAllocationRepository budgetAllocationRepository;
    private final DailyBudgetAllocationRepository dailyBudgetAllocationRepository;
    private final TransactionTemplate transactionTemplate;

    /** Creates the day's rows for every active plan covering {@code date}, one transaction per plan. */
    public JobReport createDailyBudgets(LocalDate date) {
        List<BudgetPlan> plans = budgetPlanRepository.findActiveCovering(date);
        if (plans.isEmpty()) {
            return JobReport.skipped("No active budget plan covers " + date);
        }

        int succeeded = 0;
        int failed = 0;
        int rowsCreated = 0;
        for (BudgetPlan plan : plans) {
            try {
                Integer created = transactionTemplate.execute(status -> createForPlan(plan, date));
                rowsCreated += created != null ? created : 0;
                succeeded++;
            } catch (Exception e) {
                failed++;
                log.error("Daily budgets failed for plan {}: {}", plan.getId(), e.getMessage(), e);
            }
        }
        return JobReport.of(plans.size(), succeeded, failed, "Daily rows created: " + rowsCreated);
    }

    /**
     * Planned amount per allocation is (allocated - spent before today) / days remaining. When the
     * new amounts together exceed what the plan has left, all of them shrink by the same factor.
     * Callers run it inside a transaction so the balance check and the insert see the same state.
     */
    public int createForPlan(BudgetPlan plan, LocalDate date) {
        long daysRemaining = ChronoUnit.DAYS.between(date, plan.getEndDate()) + 1;
        if (daysRemaining <= 0) {
            return 0;
        }

        List<DailyBudgetAllocation> rows = new ArrayList<>();
        BigDecimal newPlanned = BigDecimal.ZERO;
        for (BudgetAllocation allocation :
                budgetAllocationRepository.findByBudgetPlanIdOrderByIdAsc(plan.getId())) {
            if (Boolean.TRUE.equals(allocation.getLocked())
                    || dailyBudgetAllocationRepository
                            .findByBudgetAllocationIdAndBudgetDate(allocation.getId(), date)
                            .isPresent()) {
                continue;
            }

            BigDecimal spentBefore =
                    dailyBudgetAllocationRepository.sumActualSpendBefore(allocation.getId(), date);
            BigDecimal left = nonNegative(allocation.getAllocatedBudget().subtract(spentBefore));
            BigDecimal planned =
                    left.divide(BigDecimal.valueOf(daysRemaining), MONEY_SCALE, RoundingMode.DOWN);

            rows.add(
                    DailyBudgetAllocation.builder()
                            .budgetAllocation(allocation)
                            .budgetDate(date)
                            .plannedBudget(planned)
                            .build());
            newPlanned = newPlanned.add(planned);
        }
        if (rows.isEmpty()) {
            return 0;
        }

        BigDecimal balance =
                plan.getTotalBudget()
                        .subtract(dailyBudgetAllocationRepository.sumPlanActualSpendUpTo(plan.getId(), date))
                        .subtract(dailyBudgetAllocationRepository.sumPlanPlannedOn(plan.getId(), date));
        balance = nonNegative(balance);

        if (newPlanned.compareTo(balance) > 0) {
            log.warn(
                    "Plan {} on {}: planned {} exceeds remaining balance {}, scaling down",
                    plan.getId(),
                    date,
                    newPlanned,
                    balance);
            for (DailyBudgetAllocation row : rows) {
                row.setPlannedBudget(
                        row.getPlannedBudget()
                                .multiply(balance)
                                .divide(newPlanned, MONEY_SCALE, RoundingMode.DOWN));
            }
        }

        for (DailyBudgetAllocation row : rows) {
            row.setContentStyleBudgets(
                    styleBudgets(row.getPlannedBudget(), row.getBudgetAllocation().getContentStyleWeights()));
        }
        dailyBudgetAllocationRepository.saveAll(rows);

        log.info("Plan {}: created {} daily rows for {}", plan.getId(), rows.size(), date);
        return rows.size();
    }

    /** Adds spend growth to the first row of each product group on {@code date}. */
    @Transactional
    public int recordSpend(LocalDate date, Map<String, BigDecimal> growthByProductGroup) {
        Map<String, DailyBudgetAllocation> rowByProductGroup = new HashMap<>();
        for (DailyBudgetAllocation row : dailyBudgetAllocationRepository.findByBudgetDateWithPlan(date)) {
            rowByProductGroup.putIfAbsent(row.getBudgetAllocation().getProductGroup(), row);
        }

        int booked = 0;
        for (Map.Entry<String, BigDecimal> entry : growthByProductGroup.entrySet()) {
            DailyBudgetAllocation row = rowByProductGroup.get(entry.getKey());
            if (row == null) {
                log.debug("No daily row for product group {} on {}", entry.getKey(), date);
                continue;
            }
            row.setActualSpend(row.getActualSpend().add(entry.getValue()));
            dailyBudgetAllocationRepository.save(row);
            booked++;
        }
        return booked;
    }

    /** Splits the day's amount by style weight; weights need not sum to one. */
    static Map<String, BigDecimal> styleBudgets(BigDecimal planned, Map<String, BigDecimal> weights) {
        Map<String, BigDecimal> budgets = new HashMap<>();
        if (weights == null || weights.isEmpty()) {
            return budgets;
        }
        BigDecimal totalWeight =
                weights.values().stream()
                        .filter(w -> w != null && w.signum() > 0)
                        .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalWeight.signum() == 0) {
            return budgets;
        }
        weights.forEach(
                (style, weight) -> {
                    if (weight != null && weight.signum() > 0) {
                        budgets.put(
                                style,
                                planned.multiply(weight)
                                        .divide(totalWeight, MONEY_SCALE, RoundingMode.DOWN));
                    }
                });
        return budgets;
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        return value.signum() > 0 ? value : BigDecimal.ZERO;
    }
}

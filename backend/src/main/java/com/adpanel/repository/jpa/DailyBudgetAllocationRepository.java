package com.adpanel.repository.jpa;

import com.adpanel.entity.DailyBudgetAllocation;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface DailyBudgetAllocationRepository
        extends JpaRepository<DailyBudgetAllocation, Long> {

    Optional<DailyBudgetAllocation> findByBudgetAllocationIdAndBudgetDate(
            Long budgetAllocationId, LocalDate budgetDate);

    /** Daily rows of one date with allocation and plan loaded */
    @Query(
            """
        SELECT d FROM DailyBudgetAllocation d
        JOIN FETCH d.budgetAllocation a
        JOIN FETCH a.budgetPlan
        WHERE d.budgetDate = :date
        ORDER BY d.id ASC
        """)
    List<DailyBudgetAllocation> findByBudgetDateWithPlan(@Param("date") LocalDate date);

    /** Spend recorded for one allocation before the given day */
    @Query(
            """
        SELECT COALESCE(SUM(d.actualSpend), 0) FROM DailyBudgetAllocation d
        WHERE d.budgetAllocation.id = :allocationId
        AND d.budgetDate < :date
        """)
    BigDecimal sumActualSpendBefore(
            @Param("allocationId") Long allocationId, @Param("date") LocalDate date);

    /** Spend recorded across all allocations of a plan, up to and including the given day */
    @Query(
            """
        SELECT COALESCE(SUM(d.actualSpend), 0) FROM DailyBudgetAllocation d
        WHERE d.budgetAllocation.budgetPlan.id = :planId
        AND d.budgetDate <= :date
        """)
    BigDecimal sumPlanActualSpendUpTo(
            @Param("planId") Long planId, @Param("date") LocalDate date);

    /** Planned amounts already fixed for a plan on one day */
    @Query(
            """
        SELECT COALESCE(SUM(d.plannedBudget), 0) FROM DailyBudgetAllocation d
        WHERE d.budgetAllocation.budgetPlan.id = :planId
        AND d.budgetDate = :date
        """)
    BigDecimal sumPlanPlannedOn(@Param("planId") Long planId, @Param("date") LocalDate date);
}

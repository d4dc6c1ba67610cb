package com.adpanel.repository.jpa;

import com.adpanel.entity.BudgetAllocation;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BudgetAllocationRepository extends JpaRepository<BudgetAllocation, Long> {

    List<BudgetAllocation> findByBudgetPlanIdOrderByIdAsc(Long budgetPlanId);
}

package com.adpanel.repository.jpa;

import com.adpanel.entity.BudgetPlan;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface BudgetPlanRepository extends JpaRepository<BudgetPlan, Long> {

    /** Active plans whose date range contains the given day */
    @Query(
            """
        SELECT p FROM BudgetPlan p
        WHERE p.active = true
        AND p.startDate <= :date
        AND p.endDate >= :date
        ORDER BY p.id ASC
        """)
    List<BudgetPlan> findActiveCovering(@Param("date") LocalDate date);
}

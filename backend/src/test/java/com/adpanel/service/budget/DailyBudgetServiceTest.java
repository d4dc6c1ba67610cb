package com.adpanel.service.budget;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.adpanel.dto.task.JobReport;
import com.adpanel.entity.BudgetAllocation;
import com.adpanel.entity.BudgetPlan;
import com.adpanel.entity.DailyBudgetAllocation;
import com.adpanel.repository.jpa.BudgetAllocationRepository;
import com.adpanel.repository.jpa.BudgetPlanRepository;
import com.adpanel.repository.jpa.DailyBudgetAllocationRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DailyBudgetServiceTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 1);

    @Mock private BudgetPlanRepository budgetPlanRepository;
    @Mock private BudgetAllocationRepository budgetAllocationRepository;
    @Mock private DailyBudgetAllocationRepository dailyBudgetAllocationRepository;
    @Mock private TransactionTemplate transactionTemplate;

    @InjectMocks private DailyBudgetService dailyBudgetService;

    @Captor private ArgumentCaptor<List<DailyBudgetAllocation>> rowsCaptor;

    private BudgetPlan plan;
    private BudgetAllocation alpha;
    private BudgetAllocation beta;

    @BeforeEach
    void setUp() {
        // ten days including the first
        plan =
                BudgetPlan.builder()
                        .id(1L)
                        .name("March")
                        .startDate(DATE)
                        .endDate(LocalDate.of(2024, 3, 10))
                        .totalBudget(new BigDecimal("3000"))
                        .build();
        alpha = allocation(10L, "alpha", "1000");
        beta = allocation(11L, "beta", "500");

        when(budgetAllocationRepository.findByBudgetPlanIdOrderByIdAsc(1L)).thenReturn(List.of(alpha, beta));
        when(dailyBudgetAllocationRepository.findByBudgetAllocationIdAndBudgetDate(anyLong(), eq(DATE)))
                .thenReturn(Optional.empty());
        when(dailyBudgetAllocationRepository.sumActualSpendBefore(anyLong(), eq(DATE)))
                .thenReturn(BigDecimal.ZERO);
        when(dailyBudgetAllocationRepository.sumPlanActualSpendUpTo(1L, DATE)).thenReturn(BigDecimal.ZERO);
        when(dailyBudgetAllocationRepository.sumPlanPlannedOn(1L, DATE)).thenReturn(BigDecimal.ZERO);
        when(transactionTemplate.execute(any()))
                .thenAnswer(inv -> ((TransactionCallback<?>) inv.getArgument(0)).doInTransaction(null));
    }

    @Test
    @DisplayName("each allocation gets what is left divided by the days remaining")
    void createForPlan_splitsOverRemainingDays() {
        // Act
        int created = dailyBudgetService.createForPlan(plan, DATE);

        // Assert
        assertEquals(2, created);
        verify(dailyBudgetAllocationRepository).saveAll(rowsCaptor.capture());
        List<DailyBudgetAllocation> rows = rowsCaptor.getValue();
        assertEquals(new BigDecimal("100.00"), rows.get(0).getPlannedBudget());
        assertEquals(new BigDecimal("50.00"), rows.get(1).getPlannedBudget());
        assertEquals(DATE, rows.get(0).getBudgetDate());
        assertSame(alpha, rows.get(0).getBudgetAllocation());
    }

    @Test
    @DisplayName("spend before today is taken off the allocation first")
    void createForPlan_subtractsEarlierSpend() {
        // Arrange
        when(dailyBudgetAllocationRepository.sumActualSpendBefore(10L, DATE)).thenReturn(new BigDecimal("400"));

        // Act
        dailyBudgetService.createForPlan(plan, DATE);

        // Assert
        verify(dailyBudgetAllocationRepository).saveAll(rowsCaptor.capture());
        assertEquals(new BigDecimal("60.00"), rowsCaptor.getValue().get(0).getPlannedBudget());
    }

    @Test
    @DisplayName("amounts shrink proportionally when the plan balance cannot cover them")
    void createForPlan_scalesDownToBalance() {
        // Arrange
        plan.setTotalBudget(new BigDecimal("120"));

        // Act
        dailyBudgetService.createForPlan(plan, DATE);

        // Assert
        verify(dailyBudgetAllocationRepository).saveAll(rowsCaptor.capture());
        List<DailyBudgetAllocation> rows = rowsCaptor.getValue();
        assertEquals(new BigDecimal("80.00"), rows.get(0).getPlannedBudget());
        assertEquals(new BigDecimal("40.00"), rows.get(1).getPlannedBudget());
        BigDecimal total = rows.get(0).getPlannedBudget().add(rows.get(1).getPlannedBudget());
        assertTrue(total.compareTo(new BigDecimal("120")) <= 0);
    }

    @Test
    @DisplayName("planned amounts are split into style budgets by relative weight")
    void createForPlan_setsStyleBudgets() {
        // Arrange
        alpha.setContentStyleWeights(Map.of("review", new BigDecimal("3"), "tutorial", BigDecimal.ONE));

        // Act
        dailyBudgetService.createForPlan(plan, DATE);

        // Assert
        verify(dailyBudgetAllocationRepository).saveAll(rowsCaptor.capture());
        Map<String, BigDecimal> styles = rowsCaptor.getValue().get(0).getContentStyleBudgets();
        assertEquals(new BigDecimal("75.00"), styles.get("review"));
        assertEquals(new BigDecimal("25.00"), styles.get("tutorial"));
        assertTrue(rowsCaptor.getValue().get(1).getContentStyleBudgets().isEmpty());
    }

    @Test
    @DisplayName("locked allocations and existing rows are left alone")
    void createForPlan_skipsLockedAndExisting() {
        // Arrange
        alpha.setLocked(true);
        when(dailyBudgetAllocationRepository.findByBudgetAllocationIdAndBudgetDate(11L, DATE))
                .thenReturn(Optional.of(DailyBudgetAllocation.builder().id(99L).build()));

        // Act
        int created = dailyBudgetService.createForPlan(plan, DATE);

        // Assert
        assertEquals(0, created);
        verify(dailyBudgetAllocationRepository, never()).saveAll(any());
    }

    @Test
    @DisplayName("nothing to do without an active plan")
    void createDailyBudgets_noPlan() {
        when(budgetPlanRepository.findActiveCovering(DATE)).thenReturn(List.of());

        JobReport report = dailyBudgetService.createDailyBudgets(DATE);

        assertEquals(0, report.processed());
        verify(dailyBudgetAllocationRepository, never()).saveAll(any());
    }

    @Test
    @DisplayName("each plan is created in its own transaction and a failing plan does not stop the rest")
    void createDailyBudgets_transactionPerPlan() {
        // Arrange
        BudgetPlan broken =
                BudgetPlan.builder()
                        .id(2L)
                        .name("Broken")
                        .startDate(DATE)
                        .endDate(LocalDate.of(2024, 3, 10))
                        .totalBudget(new BigDecimal("100"))
                        .build();
        when(budgetPlanRepository.findActiveCovering(DATE)).thenReturn(List.of(broken, plan));
        when(budgetAllocationRepository.findByBudgetPlanIdOrderByIdAsc(2L))
                .thenThrow(new IllegalStateException("deadlock"));

        // Act
        JobReport report = dailyBudgetService.createDailyBudgets(DATE);

        // Assert
        assertEquals(2, report.processed());
        assertEquals(1, report.succeeded());
        assertEquals(1, report.failed());
        assertEquals("Daily rows created: 2", report.message());
        verify(transactionTemplate, times(2)).execute(any());
        verify(dailyBudgetAllocationRepository).saveAll(any());
    }

    @Test
    @DisplayName("spend growth is booked once per product group, on its first row")
    void recordSpend_booksFirstRow() {
        // Arrange
        DailyBudgetAllocation first = row(1L, alpha);
        DailyBudgetAllocation second = row(2L, alpha);
        DailyBudgetAllocation other = row(3L, beta);
        when(dailyBudgetAllocationRepository.findByBudgetDateWithPlan(DATE))
                .thenReturn(List.of(first, second, other));

        // Act
        int booked =
                dailyBudgetService.recordSpend(
                        DATE, Map.of("alpha", new BigDecimal("12.50"), "gamma", BigDecimal.TEN));

        // Assert
        assertEquals(1, booked);
        assertEquals(new BigDecimal("12.50"), first.getActualSpend());
        assertEquals(0, second.getActualSpend().signum());
        assertEquals(0, other.getActualSpend().signum());
        verify(dailyBudgetAllocationRepository).save(first);
    }

    private BudgetAllocation allocation(Long id, String productGroup, String amount) {
        return BudgetAllocation.builder()
                .id(id)
                .budgetPlan(plan)
                .productGroup(productGroup)
                .allocatedBudget(new BigDecimal(amount))
                .contentStyleWeights(new HashMap<>())
                .build();
    }

    private DailyBudgetAllocation row(Long id, BudgetAllocation allocation) {
        return DailyBudgetAllocation.builder()
                .id(id)
                .budgetAllocation(allocation)
                .budgetDate(DATE)
                .plannedBudget(new BigDecimal("100"))
                .build();
    }
}

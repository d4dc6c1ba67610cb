package com.adpanel.scheduler;

import com.adpanel.service.budget.DailyBudgetService;
import com.adpanel.service.optimization.BudgetOptimizerService;
import com.adpanel.service.scoring.ContentScoringService;
import com.adpanel.service.sync.AdGroupRefreshService;
import com.adpanel.service.sync.AdSpendSyncService;
import com.adpanel.service.sync.AdSyncService;
import com.adpanel.service.sync.BackfillService;
import com.adpanel.service.sync.ContentMetricsRefreshService;
import com.adpanel.service.task.StaleRunHousekeeper;
import java.time.Clock;
import java.time.LocalDate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** The pipeline's jobs. Their triggers live under {@code app.scheduling.jobs.<name>}. */
@Configuration
public class PipelineJobsConfig {

    public static final String AD_SYNC = "ad-sync";
    public static final String BACKFILL = "backfill";
    public static final String SPEND_SYNC = "spend-sync";
    public static final String ADGROUP_REFRESH = "adgroup-refresh";
    public static final String CONTENT_REFRESH = "content-refresh";
    public static final String SCORING = "scoring";
    public static final String DAILY_BUDGET = "daily-budget";
    public static final String OPTIMIZATION = "optimization";
    public static final String STALE_RUN_SWEEP = "stale-run-sweep";
    public static final String TASK_LOG_RETENTION = "task-log-retention";

    @Bean
    public PipelineJob adSyncJob(AdSyncService adSyncService) {
        return PipelineJob.of(AD_SYNC, adSyncService::syncRecent);
    }

    @Bean
    public PipelineJob backfillJob(BackfillService backfillService) {
        return PipelineJob.of(BACKFILL, backfillService::runBackfill);
    }

    @Bean
    public PipelineJob spendSyncJob(AdSpendSyncService adSpendSyncService) {
        return PipelineJob.of(SPEND_SYNC, adSpendSyncService::syncSpend);
    }

    @Bean
    public PipelineJob adGroupRefreshJob(AdGroupRefreshService adGroupRefreshService) {
        return PipelineJob.of(ADGROUP_REFRESH, adGroupRefreshService::refreshActiveAdGroups);
    }

    @Bean
    public PipelineJob contentRefreshJob(ContentMetricsRefreshService contentMetricsRefreshService) {
        return PipelineJob.of(CONTENT_REFRESH, contentMetricsRefreshService::refreshRecentContent);
    }

    @Bean
    public PipelineJob scoringJob(ContentScoringService contentScoringService) {
        return PipelineJob.of(SCORING, contentScoringService::scoreAll);
    }

    @Bean
    public PipelineJob dailyBudgetJob(DailyBudgetService dailyBudgetService, Clock clock) {
        return PipelineJob.of(
                DAILY_BUDGET, () -> dailyBudgetService.createDailyBudgets(LocalDate.now(clock)));
    }

    @Bean
    public PipelineJob optimizationJob(BudgetOptimizerService budgetOptimizerService, Clock clock) {
        return PipelineJob.of(
                OPTIMIZATION, () -> budgetOptimizerService.optimize(LocalDate.now(clock)));
    }

    @Bean
    public PipelineJob staleRunSweepJob(StaleRunHousekeeper housekeeper) {
        return PipelineJob.of(STALE_RUN_SWEEP, housekeeper::failStaleRuns, false);
    }

    @Bean
    public PipelineJob taskLogRetentionJob(StaleRunHousekeeper housekeeper) {
        return PipelineJob.of(TASK_LOG_RETENTION, housekeeper::deleteOldRuns, false);
    }
}

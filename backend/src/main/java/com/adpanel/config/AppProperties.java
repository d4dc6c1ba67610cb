package com.adpanel.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Application Configuration Properties */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid private PlatformApi platform = new PlatformApi();
    @Valid private Sync sync = new Sync();
    @Valid private Scoring scoring = new Scoring();
    @Valid private Optimizer optimizer = new Optimizer();
    @Valid private Tasks tasks = new Tasks();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class PlatformApi {
        @Valid private Api api = new Api();

        @Min(1)
        private int pageSize = 1000;

        /** Page ceiling per fetch loop */
        @Min(1)
        private int maxPages = 50;

        @Min(1)
        private int maxIdsPerRequest = 100;

        @Min(1)
        private int maxItemsPerWrite = 20;

        @Data
        public static class Api {
            @NotBlank private String url; // Loaded from PLATFORM_API_URL env var

            private String accessToken; // Loaded from PLATFORM_ACCESS_TOKEN env var

            @Min(1)
            private int timeoutMs = 30000;

            @Min(1)
            private int maxConnections = 20;
        }
    }

    @Data
    public static class Sync {
        /** Creation-time window of the recurring ad sync */
        @Min(1)
        private int recentDays = 7;

        private Backfill backfill = new Backfill();
        private ContentRefresh contentRefresh = new ContentRefresh();

        @Data
        public static class Backfill {
            @Min(1)
            private int maxChunkDays = 7;

            @Min(1)
            private int defaultLookbackDays = 30;

            @Min(1)
            private int maxAccountsPerRun = 10;
        }

        @Data
        public static class ContentRefresh {
            @Min(1)
            private int maxAgeDays = 7;

            @Min(1)
            private int maxItems = 100;
        }
    }

    @Data
    public static class Scoring {
        @Min(1)
        private int batchSize = 500;

        /** Cost per weighted engagement at or below which the cost factor is highest */
        @NotNull private BigDecimal cheapCostPerEngagement = new BigDecimal("0.10");

        @NotNull private BigDecimal goodCostPerEngagement = new BigDecimal("0.30");
        @NotNull private BigDecimal fairCostPerEngagement = new BigDecimal("0.50");

        @NotNull private BigDecimal cheapMultiplier = new BigDecimal("1.5");
        @NotNull private BigDecimal goodMultiplier = new BigDecimal("1.3");
        @NotNull private BigDecimal minCostMultiplier = new BigDecimal("0.5");

        /** Spend above which low engagement per currency unit is penalised */
        @NotNull private BigDecimal spendPenaltyThreshold = new BigDecimal("500");

        @NotNull private BigDecimal spendPenaltyMinEngagementPerUnit = new BigDecimal("1.0");
        @NotNull private BigDecimal heavySpendThreshold = new BigDecimal("1000");
        @NotNull private BigDecimal heavySpendMinEngagementPerUnit = new BigDecimal("0.5");
        @NotNull private BigDecimal heavySpendPenalty = new BigDecimal("0.7");

        @NotNull private BigDecimal organicMultiplier = new BigDecimal("1.2");
        @NotNull private BigDecimal highQualityThreshold = new BigDecimal("1.5");
    }

    @Data
    public static class Optimizer {
        @Min(1)
        private int maxItemsPerRun = 50;

        @NotNull
        @DecimalMin("0")
        private BigDecimal minimumSpendFloor = new BigDecimal("50");

        /** Checked from the highest threshold down; the first tier a score reaches applies */
        private List<ScoreTier> scoreTiers =
                new ArrayList<>(
                        List.of(
                                new ScoreTier(new BigDecimal("1.5"), new BigDecimal("1.3")),
                                new ScoreTier(new BigDecimal("1.0"), new BigDecimal("1.0")),
                                new ScoreTier(new BigDecimal("0.5"), new BigDecimal("0.7"))));

        @NotNull private BigDecimal baseTierMultiplier = new BigDecimal("0.3");

        private WriteBack writeBack = new WriteBack();

        @Data
        public static class WriteBack {
            private boolean enabled = false;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScoreTier {
        private BigDecimal minScore;
        private BigDecimal multiplier;
    }

    @Data
    public static class Tasks {
        @Min(1)
        private int staleAfterMinutes = 15;

        @Min(1)
        private int retentionDays = 30;
    }

    @Data
    public static class Scheduling {
        private Map<String, JobSchedule> jobs = new HashMap<>();

        public JobSchedule forJob(String name) {
            return jobs.getOrDefault(name, new JobSchedule());
        }
    }

    /** Trigger of one job: a cron expression wins over a fixed-delay interval. */
    @Data
    public static class JobSchedule {
        private boolean enabled = true;
        private Duration interval;
        private String cron;
    }
}

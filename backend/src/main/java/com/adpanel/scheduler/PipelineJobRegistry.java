package com.adpanel.scheduler;

import com.adpanel.config.AppProperties;
import com.adpanel.config.TracingConfig;
import com.adpanel.dto.task.JobReport;
import com.adpanel.service.task.StaleRunHousekeeper;
import com.adpanel.service.task.TaskRunService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.CronTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/**
 * Registers every {@link PipelineJob} with the scheduler. A job never overlaps itself; different
 * jobs may run at the same time on the scheduler's pool.
 */
@Slf4j
@Component
public class PipelineJobRegistry implements SchedulingConfigurer {

    static final String TIMER_NAME = "pipeline.job.duration";

    private final List<PipelineJob> jobs;
    private final AppProperties appProperties;
    private final TaskRunService taskRunService;
    private final StaleRunHousekeeper housekeeper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Map<String, AtomicBoolean> running = new ConcurrentHashMap<>();

    public PipelineJobRegistry(
            List<PipelineJob> jobs,
            AppProperties appProperties,
            TaskRunService taskRunService,
            StaleRunHousekeeper housekeeper,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.jobs = jobs;
        this.appProperties = appProperties;
        this.taskRunService = taskRunService;
        this.housekeeper = housekeeper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        // runs left RUNNING by a previous process are failed before anything new starts
        try {
            housekeeper.failStaleRuns();
        } catch (Exception e) {
            log.error("Initial stale run sweep failed: {}", e.getMessage(), e);
        }

        for (PipelineJob job : jobs) {
            AppProperties.JobSchedule schedule = appProperties.getScheduling().forJob(job.name());
            Runnable task = () -> runJob(job);

            if (!schedule.isEnabled()) {
                log.info("Job {} is disabled", job.name());
            } else if (schedule.getCron() != null && !schedule.getCron().isBlank()) {
                registrar.addCronTask(
                        new CronTask(task, new CronTrigger(schedule.getCron(), clock.getZone())));
                log.info("Job {} scheduled with cron '{}'", job.name(), schedule.getCron());
            } else if (schedule.getInterval() != null) {
                registrar.addFixedDelayTask(task, schedule.getInterval());
                log.info("Job {} scheduled every {}", job.name(), schedule.getInterval());
            } else {
                log.warn("Job {} has neither cron nor interval configured, not scheduled", job.name());
            }
        }
    }

    /**
     * Runs one job with trace MDC, run log and timing. Never throws, so a failing job cannot
     * cancel its own schedule.
     *
     * @return the job's report, or a skipped report when a previous run is still active
     */
    public JobReport runJob(PipelineJob job) {
        AtomicBoolean guard = running.computeIfAbsent(job.name(), n -> new AtomicBoolean());
        if (!guard.compareAndSet(false, true)) {
            log.warn("Job {} is still running, skipping this trigger", job.name());
            return JobReport.skipped("previous run still active");
        }

        MDC.put(TracingConfig.TRACE_ID_MDC_KEY, TracingConfig.newTraceId());
        MDC.put(TracingConfig.JOB_MDC_KEY, job.name());
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        Long runId = null;
        try {
            runId = startRun(job);
            log.info("Job {} started", job.name());

            JobReport report = job.run();
            outcome = report.hasFailures() ? "partial" : "success";
            completeRun(
                    runId,
                    !report.hasFailures(),
                    report.message(),
                    report.processed(),
                    report.succeeded(),
                    report.failed());
            log.info(
                    "Job {} finished: {} processed, {} succeeded, {} failed. {}",
                    job.name(),
                    report.processed(),
                    report.succeeded(),
                    report.failed(),
                    report.message());
            return report;
        } catch (Exception e) {
            log.error("Job {} failed: {}", job.name(), e.getMessage(), e);
            completeRun(runId, false, e.getMessage(), 0, 0, 0);
            return JobReport.of(0, 0, 1, e.getMessage());
        } finally {
            sample.stop(
                    Timer.builder(TIMER_NAME)
                            .description("Duration of pipeline job runs")
                            .tag("job", job.name())
                            .tag("outcome", outcome)
                            .register(meterRegistry));
            MDC.remove(TracingConfig.JOB_MDC_KEY);
            MDC.remove(TracingConfig.TRACE_ID_MDC_KEY);
            guard.set(false);
        }
    }

    private Long startRun(PipelineJob job) {
        if (!job.recordsRuns()) {
            return null;
        }
        try {
            return taskRunService.start(job.name());
        } catch (Exception e) {
            log.warn("Could not record start of {}: {}", job.name(), e.getMessage());
            return null;
        }
    }

    private void completeRun(
            Long runId, boolean success, String message, int processed, int succeeded, int failed) {
        if (runId == null) {
            return;
        }
        try {
            taskRunService.complete(runId, success, message, processed, succeeded, failed);
        } catch (Exception e) {
            log.warn("Could not record completion of run {}: {}", runId, e.getMessage());
        }
    }
}

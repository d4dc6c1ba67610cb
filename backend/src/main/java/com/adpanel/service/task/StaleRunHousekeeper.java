package com.adpanel.service.task;

import com.adpanel.config.AppProperties;
import com.adpanel.dto.task.JobReport;
import com.adpanel.entity.TaskLog;
import com.adpanel.entity.TaskStatus;
import com.adpanel.repository.jpa.TaskLogRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Recovers runs left RUNNING by a crashed process and prunes old run records. */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaleRunHousekeeper {

    static final String STALE_MESSAGE = "Marked failed: stale, no completion within %d minutes";

    private final TaskLogRepository taskLogRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    @Transactional
    public JobReport failStaleRuns() {
        int staleAfter = appProperties.getTasks().getStaleAfterMinutes();
        LocalDateTime now = LocalDateTime.now(clock);
        List<TaskLog> stale =
                taskLogRepository.findByStatusAndStartedAtBefore(
                        TaskStatus.RUNNING, now.minusMinutes(staleAfter));

        for (TaskLog run : stale) {
            run.setStatus(TaskStatus.FAILED);
            run.setCompletedAt(now);
            run.setMessage(String.format(STALE_MESSAGE, staleAfter));
            log.warn(
                    "Run {} of {} started {} is stale, marked failed",
                    run.getId(),
                    run.getTaskName(),
                    run.getStartedAt());
        }
        taskLogRepository.saveAll(stale);
        return JobReport.of(stale.size(), stale.size(), 0, "Stale runs failed: " + stale.size());
    }

    @Transactional
    public JobReport deleteOldRuns() {
        LocalDateTime cutoff =
                LocalDateTime.now(clock).minusDays(appProperties.getTasks().getRetentionDays());
        int deleted = taskLogRepository.deleteFinishedBefore(cutoff);
        log.info("Deleted {} run records started before {}", deleted, cutoff);
        return JobReport.of(deleted, deleted, 0, "Run records deleted: " + deleted);
    }
}

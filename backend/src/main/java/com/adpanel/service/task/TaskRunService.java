package com.adpanel.service.task;

import com.adpanel.entity.TaskLog;
import com.adpanel.entity.TaskStatus;
import com.adpanel.exception.ResourceNotFoundException;
import com.adpanel.repository.jpa.TaskLogRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Run log of pipeline jobs. Each call commits on its own so a failing job still leaves a record. */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskRunService {

    static final String DEFAULT_TRIGGER = "scheduler";

    private final TaskLogRepository taskLogRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Long start(String name) {
        return start(name, name, DEFAULT_TRIGGER);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Long start(String name, String type, String triggeredBy) {
        TaskLog run =
                taskLogRepository.save(
                        TaskLog.builder()
                                .taskName(name)
                                .taskType(type)
                                .status(TaskStatus.RUNNING)
                                .startedAt(LocalDateTime.now(clock))
                                .triggeredBy(triggeredBy)
                                .build());
        log.debug("Started run {} of {}", run.getId(), name);
        return run.getId();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TaskLog complete(
            Long runId,
            boolean success,
            String message,
            int processed,
            int succeeded,
            int failed) {
        TaskLog run =
                taskLogRepository
                        .findById(runId)
                        .orElseThrow(() -> new ResourceNotFoundException("TaskLog", runId));
        if (run.getStatus() != TaskStatus.RUNNING) {
            // already force-failed by the stale sweep; the late result is still recorded
            log.warn(
                    "Run {} of {} completed after being marked {}",
                    runId,
                    run.getTaskName(),
                    run.getStatus());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        run.setStatus(success ? TaskStatus.COMPLETED : TaskStatus.FAILED);
        run.setCompletedAt(now);
        run.setDurationSeconds(
                BigDecimal.valueOf(Duration.between(run.getStartedAt(), now).toMillis())
                        .divide(BigDecimal.valueOf(1000), 3, RoundingMode.HALF_UP));
        run.setMessage(message);
        run.setItemsProcessed(processed);
        run.setItemsSuccess(succeeded);
        run.setItemsFailed(failed);
        return taskLogRepository.save(run);
    }
}

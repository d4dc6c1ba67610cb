package com.adpanel.service.task;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.adpanel.entity.TaskLog;
import com.adpanel.entity.TaskStatus;
import com.adpanel.exception.ResourceNotFoundException;
import com.adpanel.repository.jpa.TaskLogRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TaskRunServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock private TaskLogRepository taskLogRepository;

    private TaskRunService taskRunService;

    @BeforeEach
    void setUp() {
        taskRunService = new TaskRunService(taskLogRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        when(taskLogRepository.save(any(TaskLog.class)))
                .thenAnswer(
                        inv -> {
                            TaskLog run = inv.getArgument(0);
                            if (run.getId() == null) {
                                run.setId(42L);
                            }
                            return run;
                        });
    }

    @Test
    @DisplayName("a started run is stored as RUNNING at the current time")
    void start_createsRunningRow() {
        // Act
        Long runId = taskRunService.start("ad-sync");

        // Assert
        assertEquals(42L, runId);
        ArgumentCaptor<TaskLog> captor = ArgumentCaptor.forClass(TaskLog.class);
        verify(taskLogRepository).save(captor.capture());
        TaskLog run = captor.getValue();
        assertEquals("ad-sync", run.getTaskName());
        assertEquals(TaskStatus.RUNNING, run.getStatus());
        assertEquals(LocalDateTime.of(2024, 3, 1, 10, 0), run.getStartedAt());
        assertEquals(TaskRunService.DEFAULT_TRIGGER, run.getTriggeredBy());
    }

    @Test
    @DisplayName("every run log entry point commits in its own transaction")
    void entryPoints_requireNewTransaction() throws NoSuchMethodException {
        Class<TaskRunService> type = TaskRunService.class;
        assertRequiresNew(type.getMethod("start", String.class).getAnnotation(Transactional.class));
        assertRequiresNew(
                type.getMethod("start", String.class, String.class, String.class)
                        .getAnnotation(Transactional.class));
        assertRequiresNew(
                type.getMethod(
                                "complete",
                                Long.class,
                                boolean.class,
                                String.class,
                                int.class,
                                int.class,
                                int.class)
                        .getAnnotation(Transactional.class));
    }

    @Test
    @DisplayName("completion stores outcome, counters and duration")
    void complete_recordsOutcome() {
        // Arrange
        TaskLog running =
                TaskLog.builder()
                        .id(42L)
                        .taskName("scoring")
                        .status(TaskStatus.RUNNING)
                        .startedAt(LocalDateTime.of(2024, 3, 1, 9, 58, 30))
                        .build();
        when(taskLogRepository.findById(42L)).thenReturn(Optional.of(running));

        // Act
        TaskLog done = taskRunService.complete(42L, true, "ok", 10, 9, 1);

        // Assert
        assertEquals(TaskStatus.COMPLETED, done.getStatus());
        assertEquals(new BigDecimal("90.000"), done.getDurationSeconds());
        assertEquals(9, done.getItemsSuccess());
        assertEquals(1, done.getItemsFailed());
        assertEquals("ok", done.getMessage());
    }

    @Test
    @DisplayName("a late completion of a swept run is still recorded")
    void complete_afterStaleSweep() {
        // Arrange
        TaskLog swept =
                TaskLog.builder()
                        .id(42L)
                        .taskName("backfill")
                        .status(TaskStatus.FAILED)
                        .startedAt(LocalDateTime.of(2024, 3, 1, 9, 0))
                        .build();
        when(taskLogRepository.findById(42L)).thenReturn(Optional.of(swept));

        // Act
        TaskLog done = taskRunService.complete(42L, false, "HTTP 500", 1, 0, 1);

        // Assert
        assertEquals(TaskStatus.FAILED, done.getStatus());
        assertEquals("HTTP 500", done.getMessage());
    }

    @Test
    @DisplayName("completing an unknown run fails loudly")
    void complete_unknownRun() {
        when(taskLogRepository.findById(7L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> taskRunService.complete(7L, true, null, 0, 0, 0));
    }

    private static void assertRequiresNew(Transactional transactional) {
        assertNotNull(transactional);
        assertEquals(Propagation.REQUIRES_NEW, transactional.propagation());
    }
}

package com.adpanel.repository.jpa;

import com.adpanel.entity.TaskLog;
import com.adpanel.entity.TaskStatus;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface TaskLogRepository extends JpaRepository<TaskLog, Long> {

    List<TaskLog> findByStatusAndStartedAtBefore(TaskStatus status, LocalDateTime cutoff);

    /** Delete finished runs older than the cutoff */
    @Modifying
    @Query(
            """
        DELETE FROM TaskLog t
        WHERE t.status <> com.adpanel.entity.TaskStatus.RUNNING
        AND t.startedAt < :cutoff
        """)
    int deleteFinishedBefore(@Param("cutoff") LocalDateTime cutoff);
}

package com.adpanel.repository.jpa;

import com.adpanel.entity.OptimizationLog;
import com.adpanel.entity.OptimizationStatus;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OptimizationLogRepository extends JpaRepository<OptimizationLog, Long> {

    List<OptimizationLog> findBySourceLogIdAndStatus(Long sourceLogId, OptimizationStatus status);
}

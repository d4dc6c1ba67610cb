package com.adpanel.repository.jpa;

import com.adpanel.entity.Platform;
import com.adpanel.entity.SyncCursor;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SyncCursorRepository extends JpaRepository<SyncCursor, Long> {

    Optional<SyncCursor> findByAdAccountIdAndPlatform(Long adAccountId, Platform platform);
}

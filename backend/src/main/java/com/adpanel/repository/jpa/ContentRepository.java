package com.adpanel.repository.jpa;

import com.adpanel.entity.Content;
import com.adpanel.entity.Platform;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ContentRepository extends JpaRepository<Content, Long> {

    Optional<Content> findByPlatformAndPlatformPostId(Platform platform, String platformPostId);

    List<Content> findByPlatformAndPlatformPostIdIn(
            Platform platform, Collection<String> platformPostIds);

    /** Live content ordered by id, for batch scoring */
    @Query(
            """
        SELECT c FROM Content c
        WHERE c.deletedAt IS NULL
        ORDER BY c.id ASC
        """)
    List<Content> findLiveForScoring(Pageable pageable);

    /** Best scored live content of one product group */
    @Query(
            """
        SELECT c FROM Content c
        WHERE c.deletedAt IS NULL
        AND c.productGroup = :productGroup
        AND c.performanceScore IS NOT NULL
        AND (c.expiresAt IS NULL OR c.expiresAt > :now)
        ORDER BY c.performanceScore DESC, c.id ASC
        """)
    List<Content> findTopScoredByProductGroup(
            @Param("productGroup") String productGroup,
            @Param("now") LocalDateTime now,
            Pageable pageable);

    /** Recently published live content of a platform, newest first */
    @Query(
            """
        SELECT c FROM Content c
        WHERE c.deletedAt IS NULL
        AND c.platform = :platform
        AND c.platformCreatedAt >= :since
        ORDER BY c.platformCreatedAt DESC
        """)
    List<Content> findRecentByPlatform(
            @Param("platform") Platform platform,
            @Param("since") LocalDateTime since,
            Pageable pageable);
}

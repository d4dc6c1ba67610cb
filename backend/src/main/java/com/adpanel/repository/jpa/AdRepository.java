package com.adpanel.repository.jpa;

import com.adpanel.entity.Ad;
import com.adpanel.entity.Content;
import com.adpanel.entity.Platform;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface AdRepository extends JpaRepository<Ad, Long> {

    Optional<Ad> findByPlatformAndAdGroupIdAndExternalAdId(
            Platform platform, Long adGroupId, String externalAdId);

    long countByContentId(Long contentId);

    /** Ads of an account that are linked to content, with ad group and content loaded */
    @Query(
            """
        SELECT a FROM Ad a
        JOIN FETCH a.adGroup g
        JOIN FETCH a.content
        WHERE g.campaign.adAccount.id = :accountId
        """)
    List<Ad> findLinkedByAccount(@Param("accountId") Long accountId);

    @Query(
            """
        SELECT COALESCE(SUM(a.spend), 0) FROM Ad a
        WHERE a.content.id = :contentId
        """)
    BigDecimal sumSpendByContentId(@Param("contentId") Long contentId);

    /** Distinct content referenced by the ads of one ad group */
    @Query(
            """
        SELECT DISTINCT c FROM Ad a
        JOIN a.content c
        WHERE a.adGroup.id = :adGroupId
        AND c.deletedAt IS NULL
        """)
    List<Content> findContentByAdGroupId(@Param("adGroupId") Long adGroupId);
}

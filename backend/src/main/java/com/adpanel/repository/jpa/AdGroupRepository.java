package com.adpanel.repository.jpa;

import com.adpanel.entity.AdCategory;
import com.adpanel.entity.AdGroup;
import com.adpanel.entity.EntityStatus;
import com.adpanel.entity.Platform;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface AdGroupRepository extends JpaRepository<AdGroup, Long> {

    Optional<AdGroup> findByPlatformAndCampaignIdAndExternalAdGroupId(
            Platform platform, Long campaignId, String externalAdGroupId);

    /** Ad groups of an account in the given status, with their campaigns loaded */
    @Query(
            """
        SELECT g FROM AdGroup g
        JOIN FETCH g.campaign c
        WHERE c.adAccount.id = :accountId
        AND g.status = :status
        """)
    List<AdGroup> findByAccountAndStatus(
            @Param("accountId") Long accountId, @Param("status") EntityStatus status);

    /** Ad groups of an account whose external id is in the given list */
    @Query(
            """
        SELECT g FROM AdGroup g
        WHERE g.campaign.adAccount.id = :accountId
        AND g.externalAdGroupId IN :externalIds
        """)
    List<AdGroup> findByAccountAndExternalIds(
            @Param("accountId") Long accountId, @Param("externalIds") List<String> externalIds);

    List<AdGroup> findByCategory(AdCategory category);

    /** Ad groups by id with campaign and account loaded, for use outside a session */
    @Query(
            """
        SELECT g FROM AdGroup g
        JOIN FETCH g.campaign c
        JOIN FETCH c.adAccount
        WHERE g.id IN :ids
        """)
    List<AdGroup> findAllWithAccountByIdIn(@Param("ids") List<Long> ids);

    /** Scored, active ad groups of one product group, best first */
    @Query(
            """
        SELECT g FROM AdGroup g
        JOIN FETCH g.campaign c
        JOIN FETCH c.adAccount
        WHERE g.productGroup = :productGroup
        AND g.category = :category
        AND g.status = com.adpanel.entity.EntityStatus.ACTIVE
        AND g.performanceScore IS NOT NULL
        ORDER BY g.performanceScore DESC
        """)
    List<AdGroup> findScoredByProductGroup(
            @Param("productGroup") String productGroup, @Param("category") AdCategory category);
}

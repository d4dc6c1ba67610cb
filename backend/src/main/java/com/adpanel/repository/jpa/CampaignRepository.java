package com.adpanel.repository.jpa;

import com.adpanel.entity.Campaign;
import com.adpanel.entity.Platform;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    Optional<Campaign> findByPlatformAndAdAccountIdAndExternalCampaignId(
            Platform platform, Long adAccountId, String externalCampaignId);
}

package com.adpanel.repository.jpa;

import com.adpanel.entity.AdAccount;
import com.adpanel.entity.AdAccountStatus;
import com.adpanel.entity.Platform;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AdAccountRepository extends JpaRepository<AdAccount, Long> {

    List<AdAccount> findByPlatformAndStatusOrderByIdAsc(Platform platform, AdAccountStatus status);

    Optional<AdAccount> findByPlatformAndExternalAccountId(Platform platform, String externalAccountId);
}

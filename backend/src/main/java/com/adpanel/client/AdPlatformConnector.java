package com.adpanel.client;

import com.adpanel.dto.platform.AdSpend;
import com.adpanel.dto.platform.BudgetUpdate;
import com.adpanel.dto.platform.DateWindow;
import com.adpanel.dto.platform.EntityKind;
import com.adpanel.dto.platform.FetchResult;
import com.adpanel.dto.platform.PlatformPost;
import com.adpanel.dto.platform.PlatformRecord;
import com.adpanel.dto.platform.WriteResult;
import com.adpanel.entity.EntityStatus;
import com.adpanel.entity.Platform;
import java.util.List;

/**
 * Stateless client for one advertising platform. Reads never throw: a failing call ends the page
 * loop and the result carries the rows read so far plus an error marker.
 */
public interface AdPlatformConnector {

    Platform platform();

    /**
     * Pages through one entity list.
     *
     * @param accountId platform account id
     * @param window creation-date filter, or null for all
     * @param idFilter explicit ids to fetch, or null for all
     */
    <T extends PlatformRecord> FetchResult<T> fetchEntities(
            String accountId, EntityKind<T> kind, DateWindow window, List<String> idFilter);

    /** Targeted re-fetch of a known id set, split into batches the platform accepts. */
    <T extends PlatformRecord> FetchResult<T> fetchByIds(
            String accountId, EntityKind<T> kind, List<String> ids);

    /** Lifetime spend of the given ads. */
    FetchResult<AdSpend> fetchLifetimeSpend(String accountId, List<String> adIds);

    /** Detail lookup of published posts, used to create and refresh content. */
    FetchResult<PlatformPost> fetchPostDetails(String accountId, List<String> postIds);

    WriteResult updateAdGroupBudgets(String accountId, List<BudgetUpdate> updates);

    WriteResult updateAdGroupStatus(String accountId, List<String> adGroupIds, EntityStatus status);
}

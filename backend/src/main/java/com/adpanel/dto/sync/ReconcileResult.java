package com.adpanel.dto.sync;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/** Row counts of one reconcile pass; created + updated + unchanged covers every input ad. */
@Data
public class ReconcileResult {
    private int campaignsCreated;
    private int campaignsUpdated;
    private int adGroupsCreated;
    private int adGroupsUpdated;
    private int adsCreated;
    private int adsUpdated;
    private int adsUnchanged;
    private final List<ReconciledAd> ads = new ArrayList<>();

    public int getAdsProcessed() {
        return adsCreated + adsUpdated + adsUnchanged;
    }
}

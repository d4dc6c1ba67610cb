package com.adpanel.dto.sync;

import com.adpanel.dto.platform.DateWindow;
import lombok.Builder;
import lombok.Data;

/** Outcome of syncing one account for one window. */
@Data
@Builder
public class AccountSyncResult {
    private Long accountId;
    private DateWindow window;
    private int adsFetched;
    private int skippedRows;
    private ReconcileResult reconcile;
    private LinkResult link;
    /** Set when the fetch was aborted or hit the page ceiling */
    private String error;

    public boolean isSuccess() {
        return error == null;
    }
}

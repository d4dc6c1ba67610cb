package com.adpanel.dto.platform;

import java.util.List;

/** Outcome of a batched write; ids of failed batches are listed, not retried. */
public record WriteResult(int requested, int succeeded, List<String> failedIds, String errorMessage) {

    public boolean isFullSuccess() {
        return succeeded == requested && failedIds.isEmpty();
    }
}

package com.adpanel.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/** Live write-back was requested while app.optimizer.write-back.enabled is false. */
@ResponseStatus(HttpStatus.CONFLICT)
public class PlatformWriteDisabledException extends RuntimeException {

    public PlatformWriteDisabledException(Long optimizationLogId) {
        super(
                "Platform write-back is disabled; optimization log "
                        + optimizationLogId
                        + " was not applied");
    }
}

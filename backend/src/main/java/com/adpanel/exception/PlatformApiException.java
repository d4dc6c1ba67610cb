package com.adpanel.exception;

import com.adpanel.entity.Platform;
import org.springframework.http.HttpStatus;

/**
 * Failure talking to an ad platform. Carries the HTTP status (null for transport failures) and
 * the platform's own error code when the body reported one.
 */
public class PlatformApiException extends RuntimeException {

    private final Platform platform;
    private final HttpStatus httpStatus;
    private final String platformErrorCode;
    private final String endpoint;

    public PlatformApiException(Platform platform, String message, String endpoint, Throwable cause) {
        super(message, cause);
        this.platform = platform;
        this.httpStatus = null;
        this.platformErrorCode = null;
        this.endpoint = endpoint;
    }

    public PlatformApiException(
            Platform platform,
            String message,
            HttpStatus httpStatus,
            String platformErrorCode,
            String endpoint) {
        super(message);
        this.platform = platform;
        this.httpStatus = httpStatus;
        this.platformErrorCode = platformErrorCode;
        this.endpoint = endpoint;
    }

    public Platform getPlatform() {
        return platform;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getPlatformErrorCode() {
        return platformErrorCode;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /** The request never got an HTTP answer */
    public boolean isTransportFailure() {
        return httpStatus == null && getCause() != null;
    }

    public boolean isClientError() {
        return httpStatus != null && httpStatus.is4xxClientError();
    }

    public boolean isServerError() {
        return httpStatus != null && httpStatus.is5xxServerError();
    }

    /**
     * Transport failures, rate limiting, timeouts and 5xx are worth another attempt. An error code
     * inside a 200 body is a rejected request and is not.
     */
    public boolean isRetryable() {
        if (httpStatus == null) return true;

        if (httpStatus.is4xxClientError()) {
            return httpStatus == HttpStatus.TOO_MANY_REQUESTS
                    || httpStatus == HttpStatus.REQUEST_TIMEOUT;
        }

        return httpStatus.is5xxServerError();
    }
}

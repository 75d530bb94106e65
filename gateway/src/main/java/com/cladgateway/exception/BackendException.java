package com.cladgateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * The backend call failed, returned a non-success status, or answered with
 * something that is not JSON.
 */
@Getter
public class BackendException extends GatewayException {

    private static final String CLIENT_MESSAGE = "The upstream assistant service request failed";

    private final Integer backendStatus;
    private final String responseBody;

    public BackendException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "backend_error", CLIENT_MESSAGE, message, cause);
        this.backendStatus = null;
        this.responseBody = null;
    }

    public BackendException(int backendStatus, String responseBody) {
        super(HttpStatus.BAD_GATEWAY, "backend_error", CLIENT_MESSAGE,
                "Backend returned status " + backendStatus, null);
        this.backendStatus = backendStatus;
        this.responseBody = responseBody;
    }
}

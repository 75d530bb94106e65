package com.cladgateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class for failures surfaced to API callers.
 * <p>
 * {@link #getMessage()} carries the internal diagnostic and is only logged;
 * callers see {@link #getClientMessage()} and {@link #getErrorType()}.
 */
@Getter
public abstract class GatewayException extends RuntimeException {

    private final HttpStatus status;
    private final String errorType;
    private final String clientMessage;

    protected GatewayException(HttpStatus status, String errorType, String clientMessage,
                               String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorType = errorType;
        this.clientMessage = clientMessage;
    }
}

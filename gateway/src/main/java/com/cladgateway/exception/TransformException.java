package com.cladgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * The backend reply parsed but lacks the fields the active provider needs.
 */
public class TransformException extends GatewayException {

    private static final String CLIENT_MESSAGE = "Failed to process the upstream assistant response";

    public TransformException(String message) {
        this(message, null);
    }

    public TransformException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "transform_error", CLIENT_MESSAGE, message, cause);
    }
}

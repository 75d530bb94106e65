package com.cladgateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.Duration;

@Getter
public class BackendTimeoutException extends GatewayException {

    private final Duration timeout;

    public BackendTimeoutException(Duration timeout, Throwable cause) {
        super(HttpStatus.GATEWAY_TIMEOUT, "timeout_error",
                "The upstream assistant service did not respond in time",
                "Backend call exceeded " + timeout.toMillis() + " ms", cause);
        this.timeout = timeout;
    }
}

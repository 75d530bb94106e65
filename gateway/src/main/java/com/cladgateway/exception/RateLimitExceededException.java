package com.cladgateway.exception;

import org.springframework.http.HttpStatus;

public class RateLimitExceededException extends GatewayException {

    public RateLimitExceededException() {
        super(HttpStatus.TOO_MANY_REQUESTS, "rate_limit_error",
                "Rate limit exceeded. Please try again later.",
                "Request rejected by admission control", null);
    }
}

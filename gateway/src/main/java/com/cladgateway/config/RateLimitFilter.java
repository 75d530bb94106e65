package com.cladgateway.config;

import com.cladgateway.exception.RateLimitExceededException;
import com.cladgateway.model.ChatModels;
import com.cladgateway.service.RateLimitService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Admission control: every request takes a token before it reaches a handler.
 * Runs after CORS so rejections still carry CORS headers.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class RateLimitFilter implements WebFilter {

    private final RateLimitService rateLimitService;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        RateLimitService.Admission admission = rateLimitService.tryConsume();
        ServerHttpResponse response = exchange.getResponse();
        response.getHeaders().set("X-RateLimit-Limit", String.valueOf(rateLimitService.getLimit()));
        response.getHeaders().set("X-RateLimit-Remaining", String.valueOf(admission.remaining()));

        if (admission.allowed()) {
            return chain.filter(exchange);
        }

        log.warn("Rejected {} {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath().value());
        return reject(response, admission.retryAfterSeconds());
    }

    private Mono<Void> reject(ServerHttpResponse response, long retryAfterSeconds) {
        RateLimitExceededException error = new RateLimitExceededException();
        response.setStatusCode(error.getStatus());
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        response.getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(ChatModels.ErrorResponse.of(error.getErrorType(), error.getClientMessage()));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize rate limit error", e);
            body = ("{\"error\":{\"message\":\"Rate limit exceeded\",\"type\":\"" + error.getErrorType() + "\"}}")
                    .getBytes(StandardCharsets.UTF_8);
        }
        return response.writeWith(Mono.just(response.bufferFactory().wrap(body)));
    }
}

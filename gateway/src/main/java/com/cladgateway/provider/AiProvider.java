package com.cladgateway.provider;

import com.cladgateway.config.GatewayProperties;
import com.cladgateway.exception.BackendException;
import com.cladgateway.exception.BackendTimeoutException;
import com.cladgateway.model.ChatModels;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Maps between the chat completion wire model and one backend's schema.
 * <p>
 * Implementations supply the three transformation hooks; the outbound call,
 * timeout and status handling live once in {@link #exchange} and
 * {@link #handleRequest}.
 */
public interface AiProvider {

    /**
     * Get the provider name, matched against {@code gateway.backend.provider}
     */
    String getName();

    /**
     * Build the backend payload. Never fails: on error a best-effort payload
     * is returned and the problem is logged.
     */
    JsonNode transformRequest(ChatModels.ChatRequest request);

    /**
     * Convert a backend payload into a chat completion response.
     *
     * @throws com.cladgateway.exception.TransformException if required fields are missing
     */
    ChatModels.ChatResponse transformResponse(JsonNode backendResponse, String model);

    /**
     * Pull the reply text out of a backend payload for the streaming path.
     *
     * @throws com.cladgateway.exception.TransformException if required fields are missing
     */
    String extractStreamingText(JsonNode backendResponse);

    /**
     * Send the transformed request to the backend and return its parsed JSON body.
     * Non-2xx statuses and unparseable bodies fail with {@link BackendException},
     * an expired deadline with {@link BackendTimeoutException}.
     */
    default Mono<JsonNode> exchange(WebClient client, GatewayProperties properties,
                                    ChatModels.ChatRequest request) {
        Logger log = LoggerFactory.getLogger(getClass());
        JsonNode backendRequest = transformRequest(request);
        Duration timeout = properties.getBackend().getTimeout();

        log.debug("Forwarding request to {} via provider {}", properties.getBackend().getEndpoint(), getName());

        return client.post()
                .uri(properties.getBackend().getEndpoint())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(backendRequest)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> {
                            if (!response.statusCode().is2xxSuccessful()) {
                                int status = response.statusCode().value();
                                log.error("Backend returned error {}: {}", status, body);
                                throw new BackendException(status, body);
                            }
                            return BackendPayloads.parse(body);
                        }))
                .timeout(timeout)
                .onErrorMap(AiProvider::isTimeout, e -> {
                    log.error("Backend call timed out after {} ms", timeout.toMillis());
                    return new BackendTimeoutException(timeout, e);
                })
                .onErrorMap(WebClientRequestException.class, e -> {
                    log.error("Failed to send request to backend: {}", e.getMessage());
                    return new BackendException("Failed to send request to backend: " + e.getMessage(), e);
                });
    }

    /**
     * Handle a non-streaming request end to end.
     */
    default Mono<ChatModels.ChatResponse> handleRequest(WebClient client, GatewayProperties properties,
                                                        ChatModels.ChatRequest request) {
        return exchange(client, properties, request)
                .map(backendResponse -> transformResponse(backendResponse, request.getModel()));
    }

    private static boolean isTimeout(Throwable e) {
        return e instanceof TimeoutException
                || e instanceof ReadTimeoutException
                || e.getCause() instanceof ReadTimeoutException;
    }
}

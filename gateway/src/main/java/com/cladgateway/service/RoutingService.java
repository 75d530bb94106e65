package com.cladgateway.service;

import com.cladgateway.config.GatewayProperties;
import com.cladgateway.model.ChatModels;
import com.cladgateway.provider.AiProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Sends chat requests through the provider selected by
 * {@code gateway.backend.provider}. One backend attempt per request: failures
 * are surfaced, never retried.
 */
@Slf4j
@Service
public class RoutingService {

    private final AiProvider provider;
    private final WebClient backendWebClient;
    private final GatewayProperties properties;
    private final StreamingService streamingService;
    private final MeterRegistry meterRegistry;

    public RoutingService(List<AiProvider> providers,
                          WebClient backendWebClient,
                          GatewayProperties properties,
                          StreamingService streamingService,
                          MeterRegistry meterRegistry) {
        this.provider = selectProvider(providers, properties.getBackend().getProvider());
        this.backendWebClient = backendWebClient;
        this.properties = properties;
        this.streamingService = streamingService;
        this.meterRegistry = meterRegistry;
        log.info("Using provider: {}", provider.getName());
    }

    /**
     * Route a non-streaming chat request
     */
    public Mono<ChatModels.ChatResponse> routeChat(ChatModels.ChatRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        return provider.handleRequest(backendWebClient, properties, request)
                .doOnSuccess(response -> stopTimer(sample, "success"))
                .doOnError(e -> stopTimer(sample, "error"));
    }

    /**
     * Route a chat request and replay the reply as server-sent events.
     * Backend and transform failures surface before the first event.
     */
    public Mono<Flux<ServerSentEvent<String>>> routeChatStream(ChatModels.ChatRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        return provider.exchange(backendWebClient, properties, request)
                .map(provider::extractStreamingText)
                .doOnSuccess(text -> stopTimer(sample, "success"))
                .doOnError(e -> stopTimer(sample, "error"))
                .map(text -> streamingService.stream(text, request.getModel()));
    }

    static AiProvider selectProvider(List<AiProvider> providers, String name) {
        return providers.stream()
                .filter(p -> p.getName().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unknown provider: " + name + ". Valid options are: "
                        + providers.stream().map(AiProvider::getName).collect(Collectors.joining(", "))));
    }

    private void stopTimer(Timer.Sample sample, String status) {
        sample.stop(meterRegistry.timer("gateway.backend.latency",
                "provider", provider.getName(), "status", status));
    }
}

package com.cladgateway.controller;

import com.cladgateway.model.ChatModels;
import com.cladgateway.service.RoutingService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ChatController {

    private final RoutingService routingService;
    private final MeterRegistry meterRegistry;

    /**
     * Chat completion endpoint (OpenAI-compatible). Answers with JSON, or with
     * an event stream when the request sets {@code stream: true}.
     */
    @PostMapping("/chat/completions")
    public Mono<ResponseEntity<?>> chatCompletion(@Valid @RequestBody ChatModels.ChatRequest request) {
        log.info("Chat request received: model={}, messages={}, stream={}",
                request.getModel(), request.getMessages().size(), request.isStreaming());

        String mode = request.isStreaming() ? "stream" : "complete";

        Mono<ResponseEntity<?>> response;
        if (request.isStreaming()) {
            response = routingService.routeChatStream(request)
                    .<ResponseEntity<?>>map(events -> ResponseEntity.ok()
                            .contentType(MediaType.TEXT_EVENT_STREAM)
                            .body(events));
        } else {
            response = routingService.routeChat(request)
                    .<ResponseEntity<?>>map(ResponseEntity::ok);
        }

        return response
                .doOnSuccess(r -> meterRegistry.counter("gateway.requests", "mode", mode, "status", "success").increment())
                .doOnError(e -> meterRegistry.counter("gateway.requests", "mode", mode, "status", "error").increment());
    }
}

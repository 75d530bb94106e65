package com.cladgateway.controller;

import com.cladgateway.config.GatewayProperties;
import com.cladgateway.model.ChatModels;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class AdminController {

    private static final Map<String, Object> HEALTHY = Map.of(
            "status", "healthy",
            "service", "clad-gateway"
    );

    private final GatewayProperties properties;

    /**
     * Liveness probe, never touches the backend
     */
    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.just(ResponseEntity.ok(HEALTHY));
    }

    /**
     * List available models
     */
    @GetMapping("/v1/models")
    public Mono<ResponseEntity<ChatModels.ModelList>> listModels() {
        GatewayProperties.ModelSettings model = properties.getModel();
        return Mono.just(ResponseEntity.ok(ChatModels.ModelList.builder()
                .object("list")
                .data(List.of(ChatModels.ModelDescriptor.builder()
                        .id(model.getId())
                        .object("model")
                        .created(model.getCreated())
                        .ownedBy(model.getOwnedBy())
                        .build()))
                .build()));
    }
}

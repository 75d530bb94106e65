package com.cladgateway.service;

import com.cladgateway.config.GatewayProperties;
import com.cladgateway.model.ChatModels;
import com.cladgateway.util.CompletionIds;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Replays a complete backend reply as a paced sequence of chat completion chunks.
 * <p>
 * For a reply of N words the sequence is: a role-only chunk, one chunk per
 * word for words 1..N-1, then a terminal chunk carrying word N and
 * {@code finish_reason: "stop"}. Every chunk shares one id and timestamp.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamingService {

    static final String CHUNK_OBJECT = "chat.completion.chunk";
    static final String SERIALIZATION_ERROR_EVENT =
            "{\"error\":{\"message\":\"Failed to serialize chunk\",\"type\":\"serialization_error\"}}";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;

    /**
     * Server-sent events for the reply, one {@code data:} line per chunk.
     */
    public Flux<ServerSentEvent<String>> stream(String text, String model) {
        return chunks(text, model)
                .map(this::toEvent)
                .doOnCancel(() -> log.debug("Client disconnected, streaming stopped"));
    }

    public Flux<ChatModels.ChatChunk> chunks(String text, String model) {
        return Flux.defer(() -> {
            String id = CompletionIds.next();
            long created = CompletionIds.nowEpochSeconds();
            List<String> words = words(text);
            int terminal = Math.max(words.size(), 1);
            Duration delay = properties.getStreaming().getChunkDelay();

            log.debug("Streaming {} words as {}", words.size(), id);

            return Flux.range(0, terminal + 1)
                    .concatMap(step -> {
                        if (step == 0) {
                            return Mono.just(chunk(id, created, model,
                                    ChatModels.Delta.builder().role(ChatModels.ROLE_ASSISTANT).build(), null));
                        }
                        return Mono.delay(delay).map(tick -> step < terminal
                                ? chunk(id, created, model, content(words.get(step - 1)), null)
                                : chunk(id, created, model,
                                        words.isEmpty() ? new ChatModels.Delta() : content(words.get(step - 1)),
                                        ChatModels.FINISH_STOP));
                    });
        });
    }

    ServerSentEvent<String> toEvent(ChatModels.ChatChunk chunk) {
        String data;
        try {
            data = objectMapper.writeValueAsString(chunk);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize chunk {}: {}", chunk.getId(), e.getMessage());
            data = SERIALIZATION_ERROR_EVENT;
        }
        return ServerSentEvent.builder(data).build();
    }

    static List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE.split(text))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toList());
    }

    private static ChatModels.Delta content(String word) {
        return ChatModels.Delta.builder().content(word + " ").build();
    }

    private static ChatModels.ChatChunk chunk(String id, long created, String model,
                                              ChatModels.Delta delta, String finishReason) {
        return ChatModels.ChatChunk.builder()
                .id(id)
                .object(CHUNK_OBJECT)
                .created(created)
                .model(model)
                .choices(List.of(ChatModels.ChunkChoice.builder()
                        .index(0)
                        .delta(delta)
                        .finishReason(finishReason)
                        .build()))
                .build();
    }
}

package com.cladgateway.provider;

import com.cladgateway.exception.TransformException;
import com.cladgateway.model.ChatModels;
import com.cladgateway.util.CompletionIds;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * For question/answer backends.
 * <p>
 * Request: {@code {"question": "<latest user message>"}}.
 * Response: {@code {"data": {"text": "..."}, "usage": {...}?}}.
 */
@Slf4j
@Component
public class QuestionAnswerProvider implements AiProvider {

    public static final String PROVIDER_NAME = "question-answer";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Override
    public String getName() {
        return PROVIDER_NAME;
    }

    @Override
    public JsonNode transformRequest(ChatModels.ChatRequest request) {
        List<ChatModels.Message> messages = request.getMessages() != null ? request.getMessages() : List.of();

        // Earlier turns are not forwarded; the backend only answers the latest question.
        ArrayNode context = NODES.arrayNode();
        for (ChatModels.Message message : messages) {
            if (message == null) {
                continue;
            }
            context.add(NODES.objectNode()
                    .put("role", message.getRole())
                    .put("content", message.getContent()));
        }
        log.debug("Withholding {} context messages from backend payload", context.size());

        ObjectNode payload = NODES.objectNode();
        payload.put("question", latestUserQuestion(messages));
        return payload;
    }

    @Override
    public ChatModels.ChatResponse transformResponse(JsonNode backendResponse, String model) {
        String text = extractStreamingText(backendResponse);

        return ChatModels.ChatResponse.builder()
                .id(CompletionIds.next())
                .object("chat.completion")
                .created(CompletionIds.nowEpochSeconds())
                .model(model)
                .choices(List.of(ChatModels.Choice.builder()
                        .index(0)
                        .message(ChatModels.Message.builder()
                                .role(ChatModels.ROLE_ASSISTANT)
                                .content(text)
                                .build())
                        .finishReason(ChatModels.FINISH_STOP)
                        .build()))
                .usage(usage(backendResponse.path("usage"), text))
                .build();
    }

    @Override
    public String extractStreamingText(JsonNode backendResponse) {
        JsonNode text = backendResponse.path("data").path("text");
        if (!text.isTextual()) {
            throw new TransformException("Could not extract 'data.text' field from backend response. Response: "
                    + PassThroughProvider.snapshot(backendResponse));
        }
        return text.asText();
    }

    static String latestUserQuestion(List<ChatModels.Message> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ChatModels.Message message = messages.get(i);
            if (message != null && ChatModels.ROLE_USER.equals(message.getRole())) {
                return message.getContent() != null ? message.getContent() : "";
            }
        }
        return "";
    }

    /**
     * Backend counts are used verbatim; without them the completion is
     * estimated at roughly four characters per token.
     */
    static ChatModels.Usage usage(JsonNode usage, String text) {
        if (!usage.isObject()) {
            int estimated = (text.length() + 3) / 4;
            return ChatModels.Usage.of(0, estimated);
        }
        int prompt = count(usage.path("prompt_tokens"));
        int completion = count(usage.path("completion_tokens"));
        JsonNode total = usage.path("total_tokens");
        return ChatModels.Usage.builder()
                .promptTokens(prompt)
                .completionTokens(completion)
                .totalTokens(total.isIntegralNumber() ? count(total) : prompt + completion)
                .build();
    }

    private static int count(JsonNode node) {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            return 0;
        }
        return Math.max(0, node.intValue());
    }
}

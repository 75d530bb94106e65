package com.cladgateway.provider;

import com.cladgateway.exception.TransformException;
import com.cladgateway.model.ChatModels;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * For backends that speak the chat completion format natively.
 * Requests are forwarded as-is and replies are bound directly.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PassThroughProvider implements AiProvider {

    public static final String PROVIDER_NAME = "passthrough";

    private static final int SNAPSHOT_LIMIT = 1000;

    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return PROVIDER_NAME;
    }

    @Override
    public JsonNode transformRequest(ChatModels.ChatRequest request) {
        try {
            return objectMapper.valueToTree(request);
        } catch (IllegalArgumentException e) {
            log.error("Failed to serialize request: {}", e.getMessage());
            return objectMapper.createObjectNode();
        }
    }

    @Override
    public ChatModels.ChatResponse transformResponse(JsonNode backendResponse, String model) {
        ChatModels.ChatResponse response;
        try {
            response = objectMapper.treeToValue(backendResponse, ChatModels.ChatResponse.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TransformException("Failed to parse backend response as chat completion: "
                    + e.getMessage() + ". Response: " + snapshot(backendResponse), e);
        }

        List<String> missing = missingFields(response);
        if (!missing.isEmpty()) {
            throw new TransformException("Backend response is missing " + missing
                    + ". Response: " + snapshot(backendResponse));
        }
        return response;
    }

    @Override
    public String extractStreamingText(JsonNode backendResponse) {
        JsonNode content = backendResponse.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new TransformException("Could not extract 'choices[0].message.content' from backend response. Response: "
                    + snapshot(backendResponse));
        }
        return content.asText();
    }

    private static List<String> missingFields(ChatModels.ChatResponse response) {
        List<String> missing = new ArrayList<>();
        if (response == null) {
            missing.add("body");
            return missing;
        }
        if (response.getId() == null) missing.add("id");
        if (response.getObject() == null) missing.add("object");
        if (response.getCreated() == null) missing.add("created");
        if (response.getModel() == null) missing.add("model");
        if (response.getUsage() == null) missing.add("usage");
        if (response.getChoices() == null) {
            missing.add("choices");
        } else {
            for (int i = 0; i < response.getChoices().size(); i++) {
                ChatModels.Choice choice = response.getChoices().get(i);
                if (choice == null || choice.getMessage() == null || choice.getMessage().getRole() == null) {
                    missing.add("choices[" + i + "].message");
                }
            }
        }
        return missing;
    }

    static String snapshot(JsonNode payload) {
        String text = String.valueOf(payload);
        return text.length() > SNAPSHOT_LIMIT ? text.substring(0, SNAPSHOT_LIMIT) + "..." : text;
    }
}

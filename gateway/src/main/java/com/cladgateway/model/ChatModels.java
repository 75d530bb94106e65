package com.cladgateway.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completion wire model.
 * <p>
 * Absent optional fields bind to {@code null} and are omitted again on output.
 */
public class ChatModels {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String FINISH_STOP = "stop";

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatRequest {
        @NotNull(message = "Model cannot be null")
        private String model;

        @NotNull(message = "Messages cannot be null")
        private List<@NotNull(message = "Message cannot be null") @Valid Message> messages;

        private Double temperature;

        @JsonProperty("top_p")
        private Double topP;

        private Integer n;

        private Boolean stream;

        private List<String> stop;

        @JsonProperty("max_tokens")
        private Integer maxTokens;

        @JsonProperty("presence_penalty")
        private Double presencePenalty;

        @JsonProperty("frequency_penalty")
        private Double frequencyPenalty;

        private String user;

        private List<Tool> tools;

        @JsonProperty("tool_choice")
        private JsonNode toolChoice;

        // Unrecognized top-level fields, re-emitted flat on serialization
        @Builder.Default
        @Setter(AccessLevel.NONE)
        private Map<String, JsonNode> extra = new LinkedHashMap<>();

        @JsonAnySetter
        public void putExtra(String name, JsonNode value) {
            extra.put(name, value);
        }

        @JsonAnyGetter
        public Map<String, JsonNode> getExtra() {
            return extra;
        }

        @JsonIgnore
        public boolean isStreaming() {
            return Boolean.TRUE.equals(stream);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        @NotNull(message = "Message role cannot be null")
        private String role;

        @Builder.Default
        private String content = "";

        private String name;

        @JsonProperty("tool_calls")
        private List<ToolCall> toolCalls;

        // explicit "content": null is treated like an absent field
        public void setContent(String content) {
            this.content = content != null ? content : "";
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Tool {
        private String type;
        private FunctionDefinition function;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FunctionDefinition {
        private String name;
        private String description;
        private JsonNode parameters;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolCall {
        private String id;
        private String type;
        private FunctionCall function;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FunctionCall {
        private String name;
        private String arguments;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatResponse {
        private String id;
        private String object;
        private Long created;
        private String model;
        private List<Choice> choices;
        private Usage usage;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private Integer index;
        private Message message;

        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Usage {
        @JsonProperty("prompt_tokens")
        private Integer promptTokens;

        @JsonProperty("completion_tokens")
        private Integer completionTokens;

        @JsonProperty("total_tokens")
        private Integer totalTokens;

        public static Usage of(int promptTokens, int completionTokens) {
            return new Usage(promptTokens, completionTokens, promptTokens + completionTokens);
        }
    }

    /**
     * One server-sent event of an emulated streaming response.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatChunk {
        private String id;
        private String object;
        private Long created;
        private String model;
        private List<ChunkChoice> choices;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChunkChoice {
        private Integer index;
        private Delta delta;

        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Delta {
        private String role;
        private String content;

        @JsonProperty("tool_calls")
        private List<ToolCall> toolCalls;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelDescriptor {
        private String id;
        private String object;
        private Long created;

        @JsonProperty("owned_by")
        private String ownedBy;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelList {
        private String object;
        private List<ModelDescriptor> data;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorResponse {
        private Error error;

        @Data
        @Builder
        @NoArgsConstructor
        @AllArgsConstructor
        public static class Error {
            private String message;
            private String type;
        }

        public static ErrorResponse of(String type, String message) {
            return new ErrorResponse(new Error(message, type));
        }
    }
}

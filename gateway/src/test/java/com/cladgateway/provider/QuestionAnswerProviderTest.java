package com.cladgateway.provider;

import com.cladgateway.exception.TransformException;
import com.cladgateway.model.ChatModels;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionAnswerProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final QuestionAnswerProvider provider = new QuestionAnswerProvider();

    @Test
    void sendsOnlyTheQuestion() throws Exception {
        ChatModels.ChatRequest request = request(message("user", "Tell me more about kernels."));

        JsonNode payload = provider.transformRequest(request);

        assertThat(payload).isEqualTo(objectMapper.readTree("{\"question\":\"Tell me more about kernels.\"}"));
    }

    @Test
    void questionIsTheLastUserMessage() {
        ChatModels.ChatRequest request = request(
                message("system", "You are helpful"),
                message("user", "first"),
                message("assistant", "answer"),
                message("user", "second"),
                message("assistant", "trailing"),
                message("tool", "output"));

        JsonNode payload = provider.transformRequest(request);

        assertThat(payload.path("question").asText()).isEqualTo("second");
        assertThat(payload.size()).isEqualTo(1);
    }

    @Test
    void questionIsEmptyWithoutUserMessages() {
        assertThat(provider.transformRequest(request(message("system", "s"), message("assistant", "a")))
                .path("question").asText()).isEmpty();
        assertThat(provider.transformRequest(request()).path("question").asText()).isEmpty();
    }

    @Test
    void nullMessageEntriesAreSkipped() {
        List<ChatModels.Message> messages = new ArrayList<>();
        messages.add(message("user", "asked"));
        messages.add(null);
        ChatModels.ChatRequest request = ChatModels.ChatRequest.builder().model("m").messages(messages).build();

        assertThat(provider.transformRequest(request).path("question").asText()).isEqualTo("asked");
    }

    @Test
    void questionIgnoresSurroundingMessageCount() {
        for (int before = 0; before < 4; before++) {
            for (int after = 0; after < 4; after++) {
                List<ChatModels.Message> messages = new ArrayList<>();
                for (int i = 0; i < before; i++) {
                    messages.add(message(i % 2 == 0 ? "system" : "assistant", "before-" + i));
                }
                messages.add(message("user", "target"));
                for (int i = 0; i < after; i++) {
                    messages.add(message("assistant", "after-" + i));
                }

                assertThat(QuestionAnswerProvider.latestUserQuestion(messages)).isEqualTo("target");
            }
        }
    }

    @Test
    void transformsAnswerIntoChatCompletion() throws Exception {
        JsonNode reply = objectMapper.readTree("{\"data\":{\"text\":\"Linux is modular.\"}}");

        ChatModels.ChatResponse response = provider.transformResponse(reply, "m");

        assertThat(response.getId()).startsWith("chatcmpl-");
        assertThat(response.getObject()).isEqualTo("chat.completion");
        assertThat(response.getModel()).isEqualTo("m");
        assertThat(response.getCreated()).isPositive();
        assertThat(response.getChoices()).hasSize(1);
        ChatModels.Choice choice = response.getChoices().get(0);
        assertThat(choice.getIndex()).isZero();
        assertThat(choice.getMessage().getRole()).isEqualTo("assistant");
        assertThat(choice.getMessage().getContent()).isEqualTo("Linux is modular.");
        assertThat(choice.getFinishReason()).isEqualTo("stop");
    }

    @ParameterizedTest
    @ValueSource(strings = {"{}", "{\"data\":{}}", "{\"data\":\"text\"}", "{\"data\":{\"text\":null}}",
            "{\"data\":{\"text\":7}}", "{\"text\":\"top-level\"}"})
    void missingDataTextFailsBothPaths(String body) throws Exception {
        JsonNode reply = objectMapper.readTree(body);

        assertThatThrownBy(() -> provider.transformResponse(reply, "m"))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("data.text")
                .hasMessageContaining(reply.toString());
        assertThatThrownBy(() -> provider.extractStreamingText(reply))
                .isInstanceOf(TransformException.class);
    }

    @Test
    void extractStreamingTextReadsDataText() throws Exception {
        assertThat(provider.extractStreamingText(objectMapper.readTree("{\"data\":{\"text\":\"streamed\"}}")))
                .isEqualTo("streamed");
    }

    @Test
    void usesBackendUsageVerbatim() throws Exception {
        JsonNode reply = objectMapper.readTree("{\"data\":{\"text\":\"abc\"},"
                + "\"usage\":{\"prompt_tokens\":11,\"completion_tokens\":7,\"total_tokens\":20}}");

        ChatModels.Usage usage = provider.transformResponse(reply, "m").getUsage();

        assertThat(usage.getPromptTokens()).isEqualTo(11);
        assertThat(usage.getCompletionTokens()).isEqualTo(7);
        assertThat(usage.getTotalTokens()).isEqualTo(20);
    }

    @Test
    void partialBackendUsageFillsGaps() throws Exception {
        JsonNode reply = objectMapper.readTree("{\"data\":{\"text\":\"abc\"},\"usage\":{\"completion_tokens\":5}}");

        ChatModels.Usage usage = provider.transformResponse(reply, "m").getUsage();

        assertThat(usage.getPromptTokens()).isZero();
        assertThat(usage.getCompletionTokens()).isEqualTo(5);
        assertThat(usage.getTotalTokens()).isEqualTo(5);
    }

    @Test
    void estimatesUsageWithoutBackendCounts() throws Exception {
        JsonNode reply = objectMapper.readTree("{\"data\":{\"text\":\"Linux is modular.\"}}");

        ChatModels.Usage usage = provider.transformResponse(reply, "m").getUsage();

        // 17 characters -> ceil(17 / 4)
        assertThat(usage.getPromptTokens()).isZero();
        assertThat(usage.getCompletionTokens()).isEqualTo(5);
        assertThat(usage.getTotalTokens()).isEqualTo(5);
    }

    private static ChatModels.ChatRequest request(ChatModels.Message... messages) {
        return ChatModels.ChatRequest.builder().model("m").messages(List.of(messages)).build();
    }

    private static ChatModels.Message message(String role, String content) {
        return ChatModels.Message.builder().role(role).content(content).build();
    }
}

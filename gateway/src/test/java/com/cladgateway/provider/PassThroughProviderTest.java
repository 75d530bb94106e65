package com.cladgateway.provider;

import com.cladgateway.exception.TransformException;
import com.cladgateway.model.ChatModels;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PassThroughProviderTest {

    private static final String COMPLETION = "{\"id\":\"chatcmpl-1\",\"object\":\"chat.completion\",\"created\":1700000000,"
            + "\"model\":\"m\",\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"Hi there\"},"
            + "\"finish_reason\":\"stop\"}],\"usage\":{\"prompt_tokens\":3,\"completion_tokens\":2,\"total_tokens\":5}}";

    private ObjectMapper objectMapper;
    private PassThroughProvider provider;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        provider = new PassThroughProvider(objectMapper);
    }

    @Test
    void transformRequestForwardsEveryPopulatedField() throws Exception {
        String json = "{\"model\":\"m\",\"messages\":[{\"role\":\"system\",\"content\":\"be brief\"},"
                + "{\"role\":\"user\",\"content\":\"hi\",\"name\":\"alice\"}],"
                + "\"temperature\":0.7,\"top_p\":0.95,\"n\":1,\"stream\":false,\"stop\":[\"\\n\"],"
                + "\"max_tokens\":256,\"presence_penalty\":0.5,\"frequency_penalty\":0.25,\"user\":\"u\","
                + "\"vendor_option\":{\"a\":[1,2]}}";
        ChatModels.ChatRequest request = objectMapper.readValue(json, ChatModels.ChatRequest.class);

        JsonNode payload = provider.transformRequest(request);

        assertThat(payload).isEqualTo(objectMapper.readTree(json));
    }

    @Test
    void transformRequestOmitsAbsentFields() {
        ChatModels.ChatRequest request = ChatModels.ChatRequest.builder()
                .model("m")
                .messages(List.of(ChatModels.Message.builder().role("user").content("hi").build()))
                .build();

        JsonNode payload = provider.transformRequest(request);

        assertThat(payload.fieldNames()).toIterable().containsExactlyInAnyOrder("model", "messages");
    }

    @Test
    void transformResponseBindsChatCompletion() throws Exception {
        ChatModels.ChatResponse response = provider.transformResponse(objectMapper.readTree(COMPLETION), "ignored");

        assertThat(response.getId()).isEqualTo("chatcmpl-1");
        assertThat(response.getModel()).isEqualTo("m");
        assertThat(response.getChoices().get(0).getMessage().getContent()).isEqualTo("Hi there");
        assertThat(response.getUsage().getTotalTokens()).isEqualTo(5);
    }

    @Test
    void transformResponseRejectsForeignShape() throws Exception {
        JsonNode payload = objectMapper.readTree("{\"data\":{\"text\":\"hello\"}}");

        assertThatThrownBy(() -> provider.transformResponse(payload, "m"))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("choices")
                .hasMessageContaining("\"text\":\"hello\"");
    }

    @Test
    void transformResponseRejectsNonObject() throws Exception {
        JsonNode payload = objectMapper.readTree("[1,2,3]");

        assertThatThrownBy(() -> provider.transformResponse(payload, "m"))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("[1,2,3]");
    }

    @Test
    void extractStreamingTextReadsFirstChoiceContent() throws Exception {
        assertThat(provider.extractStreamingText(objectMapper.readTree(COMPLETION))).isEqualTo("Hi there");
    }

    @Test
    void extractStreamingTextFailsWhenAnyLevelIsMissing() throws Exception {
        for (String body : List.of("{}", "{\"choices\":[]}", "{\"choices\":[{}]}",
                "{\"choices\":[{\"message\":{}}]}", "{\"choices\":[{\"message\":{\"content\":42}}]}")) {
            JsonNode payload = objectMapper.readTree(body);
            assertThatThrownBy(() -> provider.extractStreamingText(payload))
                    .as(body)
                    .isInstanceOf(TransformException.class);
        }
    }
}

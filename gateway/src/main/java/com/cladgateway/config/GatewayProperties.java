package com.cladgateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Gateway settings bound from the {@code gateway.*} namespace.
 * Immutable in practice: read once at startup and shared by reference.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    @Valid
    private BackendSettings backend = new BackendSettings();
    @Valid
    private CorsSettings cors = new CorsSettings();
    @Valid
    private RateLimitSettings rateLimit = new RateLimitSettings();
    @Valid
    private StreamingSettings streaming = new StreamingSettings();
    @Valid
    private ModelSettings model = new ModelSettings();

    @Data
    public static class BackendSettings {
        @NotBlank
        private String endpoint;
        @NotBlank
        private String provider = "question-answer";
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
        @Valid
        private AuthSettings auth = new AuthSettings();
        private ProxySettings proxies = new ProxySettings();
    }

    @Data
    public static class AuthSettings {
        @NotBlank
        private String certFile;
        @NotBlank
        private String keyFile;
    }

    @Data
    public static class ProxySettings {
        private String http;
        private String https;
    }

    @Data
    public static class CorsSettings {
        private List<String> allowedOrigins = new ArrayList<>();
    }

    @Data
    public static class RateLimitSettings {
        // sustained requests per second
        @Positive
        private long rate = 10;
        @Positive
        private long burst = 20;
    }

    @Data
    public static class StreamingSettings {
        @NotNull
        private Duration chunkDelay = Duration.ofMillis(20);
    }

    @Data
    public static class ModelSettings {
        @NotBlank
        private String id = "default-model";
        @NotBlank
        private String ownedBy = "clad-gateway";
        private long created = 1234567890L;
    }
}

package com.cladgateway.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorsConfigTest {

    private final CorsConfig corsConfig = new CorsConfig();

    @Test
    void emptyOriginListIsFatal() {
        assertThatThrownBy(() -> corsConfig.corsWebFilter(withOrigins(new ArrayList<>())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("allowed-origins");
        assertThatThrownBy(() -> corsConfig.corsWebFilter(withOrigins(List.of(" ", ""))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void buildsFilterForConfiguredOrigins() {
        assertThat(corsConfig.corsWebFilter(withOrigins(List.of("http://localhost:8080")))).isNotNull();
    }

    private static GatewayProperties withOrigins(List<String> origins) {
        GatewayProperties properties = new GatewayProperties();
        properties.getCors().setAllowedOrigins(origins);
        return properties;
    }
}

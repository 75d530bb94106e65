package com.cladgateway.config;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds the single outbound client used for every backend call.
 * <p>
 * The client presents the configured certificate/key pair (mutual TLS),
 * enforces the per-call response timeout and optionally routes through an
 * upstream proxy. Unreadable identity material aborts startup.
 */
@Slf4j
@Configuration
public class BackendClientConfig {

    @Bean
    public WebClient backendWebClient(WebClient.Builder webClientBuilder, GatewayProperties properties) {
        GatewayProperties.BackendSettings backend = properties.getBackend();
        SslContext sslContext = clientSslContext(backend.getAuth());

        HttpClient httpClient = HttpClient.create()
                .secure(spec -> spec.sslContext(sslContext))
                .responseTimeout(backend.getTimeout());
        httpClient = withProxy(httpClient, backend);

        log.info("Backend client ready: endpoint={}, timeout={}s", backend.getEndpoint(),
                backend.getTimeout().toSeconds());

        return webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    static SslContext clientSslContext(GatewayProperties.AuthSettings auth) {
        Path certFile = requireReadable(auth.getCertFile(), "certificate");
        Path keyFile = requireReadable(auth.getKeyFile(), "private key");
        CredentialFileInspector.warnIfShared(certFile);
        CredentialFileInspector.warnIfShared(keyFile);

        try {
            return SslContextBuilder.forClient()
                    .keyManager(certFile.toFile(), keyFile.toFile())
                    .build();
        } catch (SSLException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to load client identity from " + certFile + " and " + keyFile, e);
        }
    }

    static HttpClient withProxy(HttpClient httpClient, GatewayProperties.BackendSettings backend) {
        GatewayProperties.ProxySettings proxies = backend.getProxies();
        if (proxies == null) {
            return httpClient;
        }
        boolean secureEndpoint = backend.getEndpoint().regionMatches(true, 0, "https:", 0, 6);
        String proxyUrl = secureEndpoint ? proxies.getHttps() : proxies.getHttp();
        if (proxyUrl == null || proxyUrl.isBlank()) {
            return httpClient;
        }

        URI uri;
        try {
            uri = URI.create(proxyUrl);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid proxy URL: " + proxyUrl, e);
        }
        if (uri.getHost() == null) {
            throw new IllegalStateException("Invalid proxy URL: " + proxyUrl);
        }
        String host = uri.getHost();
        int port = uri.getPort() > 0 ? uri.getPort() : ("https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80);
        log.info("Backend proxy configured: {}:{}", host, port);

        return httpClient.proxy(spec -> spec.type(ProxyProvider.Proxy.HTTP).host(host).port(port));
    }

    private static Path requireReadable(String file, String description) {
        Path path = Path.of(file);
        if (!Files.isReadable(path)) {
            throw new IllegalStateException("Client " + description + " file is missing or unreadable: " + path);
        }
        return path;
    }
}

package com.example.storyboard_matcher.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.netty.resolver.DefaultAddressResolverGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(GeminiProperties.class)
public class GeminiClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiClientConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(60);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);
    private static final Duration MAX_LIFE_TIME = Duration.ofMinutes(5);
    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    @Bean("geminiWebClient")
    WebClient geminiWebClient(GeminiProperties props, MatcherProperties matcherProps) {
        Duration responseTimeout = Duration.ofSeconds(props.getTimeoutSeconds());
        int maxConnections = Math.max(matcherProps.getMaxInFlight() + 2, 4);

        ConnectionProvider provider = ConnectionProvider.builder("gemini-http")
                .maxConnections(maxConnections)
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .maxLifeTime(MAX_LIFE_TIME)
                .build();

        HttpClient httpClient = HttpClient.create(provider)
                .protocol(HttpProtocol.HTTP11)
                .responseTimeout(responseTimeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .resolver(DefaultAddressResolverGroup.INSTANCE)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(responseTimeout.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(responseTimeout.toSeconds(), TimeUnit.SECONDS)));

        LOGGER.info("Configuring Gemini WebClient baseUrl={} connect={}ms response={}s maxConn={} model={} shortlistModel={} deepModel={}",
                props.getBaseUrl(),
                CONNECT_TIMEOUT_MILLIS,
                responseTimeout.toSeconds(),
                maxConnections,
                props.getModel(),
                props.getShortlistModel(),
                props.getDeepModel());

        String apiKey = props.getApiKey() == null ? "" : props.getApiKey().trim();
        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("x-goog-api-key", apiKey)
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }
}

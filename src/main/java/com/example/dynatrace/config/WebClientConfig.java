package com.example.dynatrace.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.ProxyProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configuration for the WebClient used to communicate with the Dynatrace configuration APIs.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    /** Maximum in-memory buffer size for responses (16 MB), dashboard lists can be large */
    private static final int MAX_IN_MEMORY_SIZE_BYTES = 16 * 1024 * 1024;

    /** Max connection pool size */
    private static final int MAX_CONNECTIONS = 20;

    /** Pending acquire timeout in seconds */
    private static final int PENDING_ACQUIRE_TIMEOUT_SECONDS = 60;

    /** Max idle time for connections in seconds */
    private static final int MAX_IDLE_TIME_SECONDS = 30;

    /** Max life time for connections in seconds */
    private static final int MAX_LIFE_TIME_SECONDS = 300;

    /**
     * Configure WebClient.Builder with connection pooling, keep-alive and the timeouts
     * and proxy from {@link DynatraceApiConfig}.
     *
     * @return WebClient.Builder configured with custom HTTP client settings
     */
    @Bean
    public WebClient.Builder webClientBuilder(DynatraceApiConfig config) {
        ConnectionProvider connectionProvider = ConnectionProvider.builder("dynatrace-connection-pool")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(Duration.ofSeconds(PENDING_ACQUIRE_TIMEOUT_SECONDS))
                .maxIdleTime(Duration.ofSeconds(MAX_IDLE_TIME_SECONDS))
                .maxLifeTime(Duration.ofSeconds(MAX_LIFE_TIME_SECONDS))
                .evictInBackground(Duration.ofSeconds(120))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.getConnectionTimeout())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .responseTimeout(Duration.ofMillis(config.getReadTimeout()))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(config.getReadTimeout(), TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(config.getReadTimeout(), TimeUnit.MILLISECONDS)));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE_BYTES))
                .build();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(configureProxy(httpClient, config)))
                .exchangeStrategies(strategies);
    }

    private HttpClient configureProxy(HttpClient httpClient, DynatraceApiConfig config) {
        if (!config.isProxyEnabled() || config.getProxyHost() == null || config.getProxyHost().isEmpty()) {
            return httpClient;
        }

        log.info("Configuring proxy for Dynatrace: {}:{}", config.getProxyHost(), config.getProxyPort());
        return httpClient.proxy(proxy -> proxy
                .type(ProxyProvider.Proxy.HTTP)
                .host(config.getProxyHost())
                .port(config.getProxyPort()));
    }
}

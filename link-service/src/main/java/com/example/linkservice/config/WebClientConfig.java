package com.example.linkservice.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configuration for WebClient instances.
 */
@Configuration
public class WebClientConfig {

    /**
     * WebClient for the edge key-value store REST API.
     *
     * Connection-level timeouts cover the slowest call (bulk writes, three times the request timeout);
     * each call applies its own tighter timeout on top.
     */
    @Bean("edgeStoreWebClient")
    public WebClient edgeStoreWebClient(
            @Value("${edge-store.base-url:https://api.cloudflare.com/client/v4}") String baseUrl,
            @Value("${edge-store.request-timeout:3s}") Duration requestTimeout) {
        Duration bulkTimeout = requestTimeout.multipliedBy(3);

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) requestTimeout.toMillis())
                .responseTimeout(bulkTimeout)
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(bulkTimeout.toMillis(), TimeUnit.MILLISECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(bulkTimeout.toMillis(), TimeUnit.MILLISECONDS)));

        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024)) // 16MB bulk bodies
                .build();
    }
}

package com.deepansh.inbox.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Pooled Apache HttpClient behind every outbound RestClient.
 *
 * Every external call (session API, catalog, reasoning engine) gets a connect
 * and a response timeout from here; a timeout surfaces as
 * ResourceAccessException and is treated as retryable by the callers.
 * The trigger stream gets its own builder with a long idle timeout.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    @Primary
    public RestClient.Builder restClientBuilder(AgentProperties properties) {
        AgentProperties.Http http = properties.getHttp();
        log.info("HttpClient configured [connectTimeout={}, responseTimeout={}]",
                http.getConnectTimeout(), http.getResponseTimeout());
        return RestClient.builder()
                .requestFactory(requestFactory(http.getConnectTimeout(), http.getResponseTimeout()));
    }

    @Bean
    public RestClient.Builder streamingRestClientBuilder(AgentProperties properties) {
        AgentProperties.Http http = properties.getHttp();
        return RestClient.builder()
                .requestFactory(requestFactory(http.getConnectTimeout(), http.getStreamIdleTimeout()));
    }

    private HttpComponentsClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.of(connectTimeout))
                                        .setSocketTimeout(Timeout.of(readTimeout))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.of(readTimeout))
                        .build())
                .build();
        return new HttpComponentsClientHttpRequestFactory(httpClient);
    }
}

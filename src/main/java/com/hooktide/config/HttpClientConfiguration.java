package com.hooktide.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * RestTemplates for the two outbound collaborators, each on its own pooled
 * Apache HttpClient. Connect, pool-lease, response and socket timeouts all equal
 * the collaborator's timeout: for the registry that is the enrichment bound
 * (3000 ms by default), for the engine it limits how long a submission may take
 * to be accepted.
 *
 * The socket timeout applies per read, so a registry that trickles its body can
 * still hold a connection longer; {@code HttpRegistryClient} bounds the whole
 * exchange against its deadline on top of this.
 */
@Slf4j
@Configuration
public class HttpClientConfiguration {

    static final int MAX_CONNECTIONS = 50;

    @Bean
    public RestTemplate registryRestTemplate(RestTemplateBuilder builder, HooktideProperties properties) {
        return build(builder, "registry", properties.getRegistry().getTimeout());
    }

    @Bean
    public RestTemplate engineRestTemplate(RestTemplateBuilder builder, HooktideProperties properties) {
        return build(builder, "engine", properties.getEngine().getTimeout());
    }

    static HttpComponentsClientHttpRequestFactory requestFactory(Duration timeout) {
        Timeout bound = Timeout.ofMilliseconds(timeout.toMillis());
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(MAX_CONNECTIONS)
                .setMaxConnPerRoute(MAX_CONNECTIONS)
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(bound)
                        .setSocketTimeout(bound)
                        .build())
                .build();
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(bound)
                        .setResponseTimeout(bound)
                        .build())
                .disableAutomaticRetries()
                .build();
        return new HttpComponentsClientHttpRequestFactory(httpClient);
    }

    private RestTemplate build(RestTemplateBuilder builder, String name, Duration timeout) {
        HttpComponentsClientHttpRequestFactory factory = requestFactory(timeout);
        log.info("{} client: timeout={}ms, maxConnections={}", name, timeout.toMillis(), MAX_CONNECTIONS);

        return builder
                .requestFactory(() -> factory)
                .additionalInterceptors((request, body, execution) -> {
                    log.debug("{} request: {} {}", name, request.getMethod(), request.getURI());
                    return execution.execute(request, body);
                })
                .build();
    }
}

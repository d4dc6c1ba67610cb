package com.adpanel.config;

import java.time.Duration;
import java.util.Collections;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final ClientHttpRequestInterceptor traceIdInterceptor;
    private final AppProperties appProperties;

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    /** Every platform call is bounded by the configured per-call timeout. */
    @Bean("platformRestTemplate")
    public RestTemplate platformRestTemplate() {
        AppProperties.PlatformApi.Api api = appProperties.getPlatform().getApi();
        return createRestTemplate(
                "Platform", api.getMaxConnections(), Duration.ofMillis(api.getTimeoutMs()));
    }

    private RestTemplate createRestTemplate(
            String clientName, int maxConnections, Duration readTimeout) {
        ConnectionConfig connectionConfig =
                ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofMilliseconds(CONNECT_TIMEOUT.toMillis()))
                        .setSocketTimeout(Timeout.ofMilliseconds(readTimeout.toMillis()))
                        .build();

        PoolingHttpClientConnectionManager connectionManager =
                PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnTotal(maxConnections)
                        .setMaxConnPerRoute(maxConnections)
                        .setDefaultConnectionConfig(connectionConfig)
                        .build();

        RequestConfig requestConfig =
                RequestConfig.custom()
                        .setConnectionRequestTimeout(
                                Timeout.ofMilliseconds(CONNECT_TIMEOUT.toMillis()))
                        .setResponseTimeout(Timeout.ofMilliseconds(readTimeout.toMillis()))
                        .build();

        CloseableHttpClient httpClient =
                HttpClients.custom()
                        .setConnectionManager(connectionManager)
                        .setDefaultRequestConfig(requestConfig)
                        .setUserAgent("Ad-Panel/" + clientName + "/1.0")
                        .build();

        RestTemplate restTemplate =
                new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));
        restTemplate.setInterceptors(Collections.singletonList(traceIdInterceptor));

        log.info(
                "{} RestTemplate configured with maxConnections: {}, connect timeout: {}ms, read"
                        + " timeout: {}ms",
                clientName,
                maxConnections,
                CONNECT_TIMEOUT.toMillis(),
                readTimeout.toMillis());

        return restTemplate;
    }
}

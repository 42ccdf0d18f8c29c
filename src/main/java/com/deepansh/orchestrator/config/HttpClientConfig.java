package com.deepansh.orchestrator.config;

import com.deepansh.orchestrator.llm.LlmProperties;
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
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient behind the RestClient used for model calls.
 * The pipeline never times a collaborator call out itself; these timeouts are the only bound.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean(destroyMethod = "close")
    public CloseableHttpClient llmHttpClient(LlmProperties properties) {
        LlmProperties.Http http = properties.getHttp();
        PoolingHttpClientConnectionManager pool = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(http.getMaxConnections())
                .setMaxConnPerRoute(http.getMaxConnections())
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofMilliseconds(http.getConnectTimeoutMs()))
                        .build())
                .build();

        log.info("Model HTTP pool ready [connectTimeout={}ms, responseTimeout={}ms, maxConnections={}]",
                http.getConnectTimeoutMs(), http.getResponseTimeoutMs(), http.getMaxConnections());
        return HttpClients.custom()
                .setConnectionManager(pool)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(http.getResponseTimeoutMs()))
                        .build())
                .build();
    }

    @Bean("llmRestClientBuilder")
    public RestClient.Builder llmRestClientBuilder(CloseableHttpClient llmHttpClient) {
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(llmHttpClient));
    }
}

package com.deepansh.agentengine.config;

import com.deepansh.agentengine.llm.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient 5 behind Spring's RestClient for provider calls.
 *
 * Connect and read timeouts are the only time limits a round trip has; the engine
 * itself never interrupts one.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder llmRestClientBuilder(LlmProperties llmProperties) {
        Timeout connectTimeout = Timeout.ofMilliseconds(llmProperties.getConnectTimeoutMs());
        Timeout readTimeout = Timeout.ofMilliseconds(llmProperties.getReadTimeoutMs());

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(llmProperties.getMaxConnections())
                                .setMaxConnPerRoute(llmProperties.getMaxConnections())
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(connectTimeout)
                                        .setSocketTimeout(readTimeout)
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(readTimeout)
                        .build())
                .build();

        log.info("HttpClient configured [connectTimeout={}ms, readTimeout={}ms, maxConnections={}]",
                llmProperties.getConnectTimeoutMs(), llmProperties.getReadTimeoutMs(),
                llmProperties.getMaxConnections());
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}

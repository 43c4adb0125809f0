package com.ai.trainingstudio.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Provides the WebClient every call to the generation service goes through.
 *
 * <p>
 * Generated Word/PDF files come back as a single body, so the in-memory
 * codec limit has to cover the largest artifact the service can produce,
 * not just the JSON results.
 */
@Configuration
public class WebClientConfig {

    @Value("${studio.backend.url:http://localhost:8081}")
    private String backendBaseUrl;

    @Value("${studio.backend.connect-timeout-ms:10000}")
    private int connectTimeoutMillis;

    @Value("${studio.backend.response-timeout:PT10M}")
    private Duration responseTimeout;

    @Value("${studio.backend.max-in-memory-size:32MB}")
    private DataSize maxInMemorySize;

    @Bean
    public WebClient backendWebClient() {
        // Generation runs retrieval, an LLM call and a translation, so responses are slow
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .responseTimeout(responseTimeout);

        return WebClient.builder()
                .baseUrl(backendBaseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize((int) maxInMemorySize.toBytes()))
                .build();
    }
}

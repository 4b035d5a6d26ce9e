package com.geojoin.joiner.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    @Qualifier("polygonWebClient")
    WebClient polygonWebClient(JoinerProperties properties) {
        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.TEXT_XML_VALUE, MediaType.APPLICATION_XML_VALUE, "*/*")
            .exchangeStrategies(strategies(properties))
            .build();
    }

    @Bean
    @Qualifier("registerWebClient")
    WebClient registerWebClient(JoinerProperties properties) {
        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .exchangeStrategies(strategies(properties))
            .build();
    }

    private ExchangeStrategies strategies(JoinerProperties properties) {
        int maxBytes = Math.max(1, properties.getMaxInMemoryMb()) * 1024 * 1024;
        return ExchangeStrategies.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
            .build();
    }
}

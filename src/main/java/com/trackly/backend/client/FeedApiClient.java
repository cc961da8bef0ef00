package com.trackly.backend.client;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;

/**
 * Single-attempt HTTP access to the upstream departure feeds.
 */
@Component
public class FeedApiClient {

        private final WebClient webClient;

        @Value("${feed.api.timeout:10}")
        private int apiTimeout;

        @Value("${feed.api.key:}")
        private String apiKey;

        public FeedApiClient(WebClient.Builder webClientBuilder) {
                this.webClient = webClientBuilder
                                .codecs(configurer -> configurer
                                                .defaultCodecs()
                                                .maxInMemorySize(10 * 1024 * 1024)) // 10MB
                                .build();
        }

        /**
         * Downloads the raw feed body.
         *
         * @throws org.springframework.web.reactive.function.client.WebClientResponseException on a non-2xx status
         * @throws RuntimeException                                                                on transport failure or timeout
         */
        public byte[] download(String url) {
                return webClient.get()
                                .uri(URI.create(url))
                                .headers(headers -> {
                                        if (apiKey != null && !apiKey.isEmpty()) {
                                                headers.set("x-api-key", apiKey);
                                        }
                                })
                                .retrieve()
                                .bodyToMono(byte[].class)
                                .timeout(Duration.ofSeconds(apiTimeout))
                                .block();
        }
}

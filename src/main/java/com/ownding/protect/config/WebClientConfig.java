package com.ownding.protect.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public ConnectionProvider protectConnectionProvider(AppProperties appProperties) {
        AppProperties.Protect protect = appProperties.getProtect();
        return ConnectionProvider.builder("protect")
                .maxConnections(protect.getMaxConnections())
                .maxIdleTime(Duration.ofSeconds(protect.getMaxIdleSeconds()))
                .build();
    }

    @Bean
    public WebClient.Builder webClientBuilder(ConnectionProvider protectConnectionProvider,
                                              AppProperties appProperties) {
        HttpClient httpClient = HttpClient.create(protectConnectionProvider);
        // snapshots and large camera lists exceed the 256 KiB codec default
        int maxInMemoryBytes = appProperties.getProtect().getMaxInMemoryBytes();
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemoryBytes));
    }

    @Bean
    public WebClient webClient(WebClient.Builder builder) {
        return builder.build();
    }
}

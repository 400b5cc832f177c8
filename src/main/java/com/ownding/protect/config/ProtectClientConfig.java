package com.ownding.protect.config;

import com.ownding.protect.client.ProtectRequestExecutor;
import com.ownding.protect.client.ProtectService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class ProtectClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ProtectClientConfig.class);

    @Bean
    public ProtectRequestExecutor protectRequestExecutor(WebClient webClient, AppProperties appProperties) {
        AppProperties.Protect protect = appProperties.getProtect();
        ProtectRequestExecutor executor = new ProtectRequestExecutor(webClient, protect.getHost(), protect.getApiKey());
        log.info("Protect integration API at {}", executor.getBaseUrl());
        return executor;
    }

    // one instance, so the collection caches live as long as the application
    @Bean
    public ProtectService protectService(ProtectRequestExecutor protectRequestExecutor) {
        return new ProtectService(protectRequestExecutor);
    }
}

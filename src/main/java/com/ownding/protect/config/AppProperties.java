package com.ownding.protect.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    private final Protect protect = new Protect();

    public Protect getProtect() {
        return protect;
    }

    public static class Protect {
        /**
         * Controller host, optionally with a port, e.g. {@code 192.168.1.1} or {@code 10.0.0.1:7443}.
         */
        @NotBlank
        private String host;
        @NotBlank
        private String apiKey;
        @Min(1)
        private int maxConnections = 8;
        @Min(1)
        private int maxIdleSeconds = 30;
        /**
         * Largest response body buffered in memory, {@code -1} for no limit.
         */
        @Min(-1)
        private int maxInMemoryBytes = 16 * 1024 * 1024;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getMaxConnections() {
            return maxConnections;
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
        }

        public int getMaxIdleSeconds() {
            return maxIdleSeconds;
        }

        public void setMaxIdleSeconds(int maxIdleSeconds) {
            this.maxIdleSeconds = maxIdleSeconds;
        }

        public int getMaxInMemoryBytes() {
            return maxInMemoryBytes;
        }

        public void setMaxInMemoryBytes(int maxInMemoryBytes) {
            this.maxInMemoryBytes = maxInMemoryBytes;
        }
    }
}

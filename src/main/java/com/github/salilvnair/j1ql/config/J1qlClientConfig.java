package com.github.salilvnair.j1ql.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "j1ql.client")
@Getter
@Setter
public class J1qlClientConfig {

    public static final String DEFAULT_REGION = "us";

    private String apiKey;
    private String accountId;
    private String region = DEFAULT_REGION;
    /**
     * Overrides the GraphQL endpoint derived from {@link #region}.
     */
    private String baseUrl;
    private int connectTimeoutMs = 10000;
    private int requestTimeoutMs = 60000;
    private long pollIntervalMs = 200L;
    private boolean includeDeleted = false;
    private Retry retry = new Retry();

    public String resolveBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return baseUrl.trim();
        }
        String safeRegion = region == null || region.isBlank() ? DEFAULT_REGION : region.trim();
        return "https://graphql." + safeRegion + ".jupiterone.io";
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 5;
        private long initialBackoffMs = 1000L;
        private long maxBackoffMs = 8000L;
        private double backoffMultiplier = 2.0d;
        private List<Integer> retryStatusCodes = new ArrayList<>(List.of(429, 502, 503, 504));
        private boolean retryOnIOException = true;
    }
}

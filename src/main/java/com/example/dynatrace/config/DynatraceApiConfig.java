package com.example.dynatrace.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration class for Dynatrace API settings.
 * Holds the environment URL, the API token and connection settings of the environment
 * that configuration objects are synchronized with.
 */
@Configuration
public class DynatraceApiConfig {

    @Value("${dynatrace.environment-url:}")
    private String environmentUrl;

    @Value("${dynatrace.api-token:}")
    private String apiToken;

    @Value("${dynatrace.proxy.enabled:false}")
    private boolean proxyEnabled;

    @Value("${dynatrace.proxy.host:}")
    private String proxyHost;

    @Value("${dynatrace.proxy.port:8080}")
    private int proxyPort;

    @Value("${dynatrace.connection.timeout:30000}")
    private int connectionTimeout;

    @Value("${dynatrace.read.timeout:60000}")
    private int readTimeout;

    public String getEnvironmentUrl() {
        return environmentUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public boolean isProxyEnabled() {
        return proxyEnabled;
    }

    public String getProxyHost() {
        return proxyHost;
    }

    public int getProxyPort() {
        return proxyPort;
    }

    public int getConnectionTimeout() {
        return connectionTimeout;
    }

    public int getReadTimeout() {
        return readTimeout;
    }

    /**
     * Check if a Dynatrace environment is configured
     */
    public boolean isConfigured() {
        return environmentUrl != null && !environmentUrl.isEmpty()
               && apiToken != null && !apiToken.isEmpty();
    }
}

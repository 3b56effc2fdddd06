package com.querytuner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Connection settings for the ClickHouse server that runs the EXPLAIN statements.
 *
 * <p>Properties are loaded from the {@code app.clickhouse} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   clickhouse:
 *     base-url: http://localhost:8123
 *     database: default
 *     user: default
 *     password: ${CLICKHOUSE_PASSWORD:}
 *     timeout-seconds: 30
 *     retry:
 *       max-attempts: 2
 *       initial-backoff-millis: 200
 * </pre>
 *
 * <p>The client talks to the HTTP interface, so {@code base-url} is the HTTP(S) port
 * (8123 / 8443), not the native protocol port.
 */
@Data
@ConfigurationProperties(prefix = "app.clickhouse")
public class ClickHouseConfig {

    private String baseUrl = "http://localhost:8123";

    private String database = "default";

    private String user = "default";

    private String password = "";

    /**
     * Per-request response timeout.
     */
    private long timeoutSeconds = 30;

    private RetryConfig retry = new RetryConfig();

    /**
     * Host part of {@link #baseUrl}, as reported by the server settings endpoint.
     */
    public String getHost() {
        String url = baseUrl == null ? "" : baseUrl;
        int scheme = url.indexOf("://");
        String host = scheme >= 0 ? url.substring(scheme + 3) : url;
        int slash = host.indexOf('/');
        return slash >= 0 ? host.substring(0, slash) : host;
    }

    /**
     * Retry settings for transient HTTP failures.
     */
    @Data
    public static class RetryConfig {

        /**
         * Retries after the first attempt. 0 disables retrying.
         */
        private int maxAttempts = 2;

        private long initialBackoffMillis = 200;

        private long maxBackoffMillis = 2000;

        /**
         * HTTP status codes that trigger a retry. Engine-side query errors come back as
         * 4xx/500 with an exception body and are not worth retrying, so the default list
         * only holds gateway and throttling codes.
         */
        private List<Integer> retryableStatusCodes = List.of(429, 502, 503, 504);
    }
}

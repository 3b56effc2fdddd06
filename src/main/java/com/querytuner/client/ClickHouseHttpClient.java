package com.querytuner.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querytuner.config.ClickHouseConfig;
import com.querytuner.exception.ExplainEngineException;
import com.querytuner.model.explain.EstimateRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * ClickHouse over its HTTP interface.
 *
 * <p>The statement is POSTed as the request body unchanged, and the response format is
 * chosen with the {@code default_format} URL parameter, so the text built by
 * {@code ExplainQueryBuilder} is exactly what the server parses.
 * {@code JSONCompact} returns rows as arrays under {@code data}.
 */
@Slf4j
@Component
public class ClickHouseHttpClient implements ExplainEngine {

    private static final String FORMAT = "JSONCompact";

    private final ClickHouseConfig config;
    private final ObjectMapper objectMapper;
    private final WebClient webClient;

    public ClickHouseHttpClient(ClickHouseConfig config, ObjectMapper objectMapper, WebClient.Builder builder) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.webClient = builder
                .baseUrl(config.getBaseUrl())
                .defaultHeader("X-ClickHouse-User", config.getUser())
                .defaultHeader("X-ClickHouse-Key", config.getPassword() == null ? "" : config.getPassword())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }

    @Override
    public List<String> queryLines(String sql) {
        JsonNode data = execute(sql).path("data");
        List<String> lines = new ArrayList<>();
        for (JsonNode row : data) {
            lines.add(row.path(0).asText());
        }
        return lines;
    }

    @Override
    public List<EstimateRow> queryEstimate(String sql) {
        JsonNode data = execute(sql).path("data");
        List<EstimateRow> rows = new ArrayList<>();
        for (JsonNode row : data) {
            if (row.size() < 5) {
                throw new ExplainEngineException("Unexpected EXPLAIN ESTIMATE row: expected 5 columns, got " + row.size(), null);
            }
            // 64-bit counters arrive as quoted strings; asLong() parses both forms
            rows.add(new EstimateRow(
                    row.path(0).asText(),
                    row.path(1).asText(),
                    row.path(2).asLong(),
                    row.path(3).asLong(),
                    row.path(4).asLong()));
        }
        return rows;
    }

    @Override
    public Optional<String> fetchSetting(String name) {
        String escaped = name.replace("\\", "\\\\").replace("'", "\\'");
        List<String> values = queryLines("SELECT value FROM system.settings WHERE name = '" + escaped + "'");
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    @Override
    public void ping() {
        try {
            webClient.get()
                    .uri("/ping")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(5));
        } catch (WebClientResponseException e) {
            throw new ExplainEngineException(describe(e), e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new ExplainEngineException(e.getMessage(), e);
        }
    }

    private JsonNode execute(String sql) {
        try {
            String body = webClient.post()
                    .uri(uriBuilder -> uriBuilder.path("/")
                            .queryParam("database", config.getDatabase())
                            .queryParam("default_format", FORMAT)
                            .build())
                    .contentType(MediaType.TEXT_PLAIN)
                    .bodyValue(sql)
                    .retrieve()
                    .bodyToMono(String.class)
                    .retryWhen(buildRetrySpec())
                    .block(Duration.ofSeconds(config.getTimeoutSeconds()));
            if (body == null || body.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(body);
        } catch (WebClientResponseException e) {
            throw new ExplainEngineException(describe(e), e.getStatusCode().value(), e);
        } catch (JsonProcessingException e) {
            throw new ExplainEngineException("Unreadable ClickHouse response: " + e.getOriginalMessage(), e);
        } catch (RuntimeException e) {
            // connection refused, timeout
            throw new ExplainEngineException(String.valueOf(e.getMessage()), e);
        }
    }

    private Retry buildRetrySpec() {
        ClickHouseConfig.RetryConfig retry = config.getRetry();
        return Retry.backoff(retry.getMaxAttempts(), Duration.ofMillis(retry.getInitialBackoffMillis()))
                .maxBackoff(Duration.ofMillis(retry.getMaxBackoffMillis()))
                .filter(this::isRetryable)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private boolean isRetryable(Throwable ex) {
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        List<Integer> codes = config.getRetry().getRetryableStatusCodes();
        boolean retryable = codes != null && codes.contains(webEx.getStatusCode().value());
        if (retryable) {
            log.warn("ClickHouse returned {}, retrying", webEx.getStatusCode().value());
        }
        return retryable;
    }

    /**
     * ClickHouse puts the exception text in the body; that is what the user needs to see.
     */
    private String describe(WebClientResponseException e) {
        String body = e.getResponseBodyAsString();
        return body == null || body.isBlank() ? e.getMessage() : body.trim();
    }
}

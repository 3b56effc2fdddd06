package com.querytuner.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.querytuner.api.ExplainRequest;
import com.querytuner.api.ExplainResponse;
import com.querytuner.api.PingResponse;
import com.querytuner.client.ExplainEngine;
import com.querytuner.config.ClickHouseConfig;
import com.querytuner.config.ExplainProperties;
import com.querytuner.model.branch.QueryVersion;
import com.querytuner.model.explain.ExplainConfig;
import com.querytuner.model.explain.ExplainResult;
import com.querytuner.model.explain.ExplainType;
import com.querytuner.model.stats.StatValue;
import com.querytuner.service.AutoBranchPolicy;
import com.querytuner.service.AutoBranchPolicy.AutoBranchResult;
import com.querytuner.service.ExplainService;
import com.querytuner.service.VersionGraphService;
import com.querytuner.service.cache.ResultReuseCache;
import com.querytuner.service.cache.ResultReuseCache.ReuseDecision;
import com.querytuner.service.explain.ExplainExecutor;
import com.querytuner.service.explain.ExplainExecutor.ExplainOptions;
import com.querytuner.util.QueryHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Implementation of ExplainService.
 *
 * Flow of one run:
 * <ol>
 *   <li>hash the query and validate the parent reference
 *   <li>return the parent unchanged when its results can be reused
 *   <li>let the auto-branch policy pick the target branch
 *   <li>resolve configs, budget and log comment
 *   <li>run the diagnostics, capturing failures per result
 *   <li>save the new version
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExplainServiceImpl implements ExplainService {

    static final String ANALYZER_SETTING = "enable_analyzer";

    private final VersionGraphService versionGraph;
    private final ResultReuseCache reuseCache;
    private final AutoBranchPolicy autoBranchPolicy;
    private final ExplainExecutor executor;
    private final ExplainEngine engine;
    private final ExplainProperties explainProperties;
    private final ClickHouseConfig clickHouseConfig;
    private final ObjectMapper objectMapper;

    @Override
    public ExplainResponse explain(ExplainRequest request) {
        String query = request.getQuery() == null ? "" : request.getQuery();
        String queryHash = QueryHasher.hash(query);
        String parentId = request.getParentVersionId();

        if (parentId != null && !parentId.isEmpty() && versionGraph.getVersion(parentId).isEmpty()) {
            throw new IllegalArgumentException("Parent version does not exist: " + parentId);
        }

        ReuseDecision reuse = reuseCache.checkReuse(parentId, queryHash);
        if (reuse.reuse()) {
            return ExplainResponse.builder()
                    .version(reuse.version())
                    .resultsReused(true)
                    .build();
        }

        AutoBranchResult target = autoBranchPolicy.resolve(request.getBranchId(), parentId);

        List<ExplainConfig> configs = filterConfigs(
                resolveConfigs(request.getExplainConfigs()), request.getServerSettings(), request.isForceAnalyzer());
        int budget = request.getMaxExecutionTimeMs() > 0
                ? request.getMaxExecutionTimeMs()
                : explainProperties.getDefaultMaxExecutionTimeMs();
        ExplainOptions options = new ExplainOptions(buildLogComment(queryHash), request.isForceAnalyzer(), budget);

        Stopwatch stopwatch = Stopwatch.createStarted();
        List<ExplainResult> results = executor.executeAll(configs, query, options);
        long elapsedMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);

        QueryVersion saved = versionGraph.saveVersion(QueryVersion.builder()
                .branchId(target.targetBranchId())
                .query(query)
                .queryHash(queryHash)
                .explainResults(results)
                .executionStats(buildStats(results, elapsedMs, budget, request.isForceAnalyzer()))
                .parentVersionId(parentId)
                .build());

        log.info("Explained version {} on branch {}: {} results in {} ms",
                saved.getId(), saved.getBranchId(), results.size(), elapsedMs);

        return ExplainResponse.builder()
                .version(saved)
                .autoBranched(target.autoBranched())
                .newBranch(target.autoBranched() ? target.newBranch() : null)
                .resultsReused(false)
                .warning(target.warning())
                .build();
    }

    @Override
    public List<ExplainConfig> getDefaultConfigs() {
        return ExplainConfig.defaults();
    }

    @Override
    public Map<String, String> getServerSettings() {
        Map<String, String> settings = new LinkedHashMap<>();
        String analyzer;
        try {
            analyzer = engine.fetchSetting(ANALYZER_SETTING).orElse("0");
        } catch (RuntimeException e) {
            log.warn("Failed to read {}: {}", ANALYZER_SETTING, e.getMessage());
            analyzer = "0";
        }
        settings.put(ANALYZER_SETTING, analyzer);
        settings.put("host", clickHouseConfig.getHost());
        settings.put("database", clickHouseConfig.getDatabase());
        return settings;
    }

    @Override
    public PingResponse ping() {
        PingResponse.PingResponseBuilder response = PingResponse.builder()
                .timestamp(Instant.now().getEpochSecond());
        try {
            engine.ping();
            return response.connected(true).build();
        } catch (RuntimeException e) {
            log.warn("Engine ping failed: {}", e.getMessage());
            return response.connected(false).error(e.getMessage()).build();
        }
    }

    static List<ExplainConfig> resolveConfigs(List<ExplainConfig> requested) {
        if (requested == null || requested.isEmpty()) {
            log.debug("No EXPLAIN configs in request, using defaults");
            return ExplainConfig.defaults();
        }
        return requested;
    }

    /**
     * QUERY TREE needs the new analyzer; skip it when the server has it off and the
     * request does not force it on.
     */
    static List<ExplainConfig> filterConfigs(List<ExplainConfig> configs, Map<String, String> serverSettings,
                                             boolean forceAnalyzer) {
        if (forceAnalyzer || serverSettings == null || !"0".equals(serverSettings.get(ANALYZER_SETTING))) {
            return configs;
        }
        return configs.stream()
                .filter(c -> c.getType() != ExplainType.QUERY_TREE)
                .collect(Collectors.toList());
    }

    /**
     * JSON with sorted keys, matched on the engine side through {@code system.query_log}.
     */
    String buildLogComment(String queryHash) {
        Map<String, String> comment = new LinkedHashMap<>();
        comment.put("product", explainProperties.getProduct());
        comment.put("query_version", queryHash);
        try {
            return objectMapper.writeValueAsString(comment);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize log comment", e);
        }
    }

    private static Map<String, StatValue> buildStats(List<ExplainResult> results, long elapsedMs, int budget,
                                                     boolean forceAnalyzer) {
        Map<String, StatValue> stats = new LinkedHashMap<>();
        stats.put("explainCount", StatValue.of(results.size()));
        stats.put("errorCount", StatValue.of(results.stream().filter(ExplainResult::hasError).count()));
        stats.put("durationMs", StatValue.of(elapsedMs));
        stats.put("maxExecutionTimeMs", StatValue.of(budget));
        stats.put("forceAnalyzer", StatValue.of(forceAnalyzer));
        return stats;
    }
}

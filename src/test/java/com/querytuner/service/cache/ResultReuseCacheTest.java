package com.querytuner.service.cache;

import com.querytuner.model.branch.QueryVersion;
import com.querytuner.model.explain.ExplainResult;
import com.querytuner.model.explain.ExplainType;
import com.querytuner.service.VersionGraphService;
import com.querytuner.service.cache.ResultReuseCache.ReuseDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Result reuse")
class ResultReuseCacheTest {

    private static final String HASH = "a".repeat(64);

    @Mock
    private VersionGraphService versionGraph;

    private ResultReuseCache cache;

    @BeforeEach
    void setUp() {
        cache = new ResultReuseCache(versionGraph);
    }

    private static QueryVersion parent(String hash, List<ExplainResult> results) {
        return QueryVersion.builder()
                .id("p1")
                .branchId("b1")
                .query("SELECT 1")
                .queryHash(hash)
                .explainResults(results)
                .build();
    }

    @Test
    @DisplayName("Empty parent id never reuses and never looks anything up")
    void noParent() {
        assertThat(cache.checkReuse("", HASH).reuse()).isFalse();
        assertThat(cache.checkReuse(null, HASH).reuse()).isFalse();
        verify(versionGraph, never()).getVersion(anyString());
    }

    @Test
    @DisplayName("Unknown parent is a miss")
    void unknownParent() {
        when(versionGraph.getVersion("p1")).thenReturn(Optional.empty());

        assertThat(cache.checkReuse("p1", HASH).reuse()).isFalse();
    }

    @Test
    @DisplayName("Same hash with clean results is reused")
    void hit() {
        QueryVersion version = parent(HASH, List.of(ExplainResult.text(ExplainType.PLAN, "Expression")));
        when(versionGraph.getVersion("p1")).thenReturn(Optional.of(version));

        ReuseDecision decision = cache.checkReuse("p1", HASH);

        assertThat(decision.reuse()).isTrue();
        assertThat(decision.version()).isSameAs(version);
    }

    @Test
    @DisplayName("Different hash is a miss")
    void differentHash() {
        when(versionGraph.getVersion("p1")).thenReturn(Optional.of(
                parent("b".repeat(64), List.of(ExplainResult.text(ExplainType.PLAN, "x")))));

        assertThat(cache.checkReuse("p1", HASH).reuse()).isFalse();
    }

    @Test
    @DisplayName("Parent without results is a miss")
    void noResults() {
        when(versionGraph.getVersion("p1")).thenReturn(Optional.of(parent(HASH, List.of())));

        assertThat(cache.checkReuse("p1", HASH).reuse()).isFalse();
    }

    @Test
    @DisplayName("One failed result is enough to re-run")
    void failedResult() {
        when(versionGraph.getVersion("p1")).thenReturn(Optional.of(parent(HASH, List.of(
                ExplainResult.text(ExplainType.PLAN, "x"),
                ExplainResult.failure(ExplainType.QUERY_TREE, "Query error: timeout")))));

        ReuseDecision decision = cache.checkReuse("p1", HASH);

        assertThat(decision.reuse()).isFalse();
        assertThat(decision.version()).isNull();
    }
}

package com.querytuner.model.branch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.querytuner.model.explain.ExplainResult;
import com.querytuner.model.stats.StatValue;
import com.querytuner.model.tag.VersionTag;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One immutable snapshot of the query text together with the EXPLAIN output captured
 * for it.
 *
 * Versions link to the version they were edited from, forming the history graph. The
 * row is written once by the version graph and never updated; only the transient
 * {@code tags} list is filled in when a history listing is decorated.
 */
@Getter
@ToString
@Entity
@Immutable
@Table(name = "QUERY_VERSIONS", indexes = {
        @Index(name = "idx_version_branch", columnList = "branch_id, created_at"),
        @Index(name = "idx_version_hash", columnList = "query_hash")
})
@Builder(toBuilder = true)
@NoArgsConstructor(access = lombok.AccessLevel.PROTECTED)
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryVersion {

    @Id
    @Column(name = "id", nullable = false, length = 36, updatable = false)
    private String id;

    @Column(name = "branch_id", nullable = false, length = 36, updatable = false)
    private String branchId;

    @Lob
    @Column(name = "query", nullable = false, updatable = false)
    private String query;

    /**
     * SHA-256 hex of {@link #query}; drives result reuse.
     */
    @Column(name = "query_hash", nullable = false, length = 64, updatable = false)
    private String queryHash;

    @Lob
    @Builder.Default
    @Convert(converter = ExplainResultsConverter.class)
    @Column(name = "explain_results", updatable = false)
    private List<ExplainResult> explainResults = new ArrayList<>();

    @Lob
    @Builder.Default
    @Convert(converter = ExecutionStatsConverter.class)
    @Column(name = "execution_stats", updatable = false)
    private Map<String, StatValue> executionStats = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * Version this one was edited from. Null for the first version of a branch.
     */
    @Column(name = "parent_version_id", length = 36, updatable = false)
    private String parentVersionId;

    @Setter
    @Transient
    @Builder.Default
    private List<VersionTag> tags = new ArrayList<>();

    public boolean hasParent() {
        return parentVersionId != null && !parentVersionId.isEmpty();
    }

    public boolean hasErrors() {
        return explainResults != null && explainResults.stream().anyMatch(ExplainResult::hasError);
    }
}

package com.querytuner.service.cache;

import com.querytuner.model.branch.QueryVersion;
import com.querytuner.service.VersionGraphService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether a run can return its parent version instead of calling the engine.
 *
 * <p>A parent qualifies when its query hash equals the new one and it holds at least one
 * EXPLAIN result, none of them failed. Read-only: nothing is written on either outcome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultReuseCache {

    private final VersionGraphService versionGraph;

    public ReuseDecision checkReuse(String parentVersionId, String queryHash) {
        if (parentVersionId == null || parentVersionId.isEmpty()) {
            return ReuseDecision.miss();
        }

        Optional<QueryVersion> parent = versionGraph.getVersion(parentVersionId);
        if (parent.isEmpty()) {
            return ReuseDecision.miss();
        }

        QueryVersion version = parent.get();
        if (!version.getQueryHash().equals(queryHash)) {
            return ReuseDecision.miss();
        }
        if (version.getExplainResults() == null || version.getExplainResults().isEmpty()) {
            log.debug("Parent {} has the same query but no results", parentVersionId);
            return ReuseDecision.miss();
        }
        if (version.hasErrors()) {
            log.debug("Parent {} has the same query but failed results", parentVersionId);
            return ReuseDecision.miss();
        }

        log.info("Reusing results of version {}", parentVersionId);
        return ReuseDecision.hit(version);
    }

    /**
     * @param reuse   true when {@code version} should be returned as-is
     * @param version the reusable parent, null on a miss
     */
    public record ReuseDecision(boolean reuse, QueryVersion version) {

        static ReuseDecision miss() {
            return new ReuseDecision(false, null);
        }

        static ReuseDecision hit(QueryVersion version) {
            return new ReuseDecision(true, version);
        }
    }
}

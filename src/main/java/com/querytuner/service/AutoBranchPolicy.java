package com.querytuner.service;

import com.querytuner.config.ExplainProperties;
import com.querytuner.model.branch.Branch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Picks the branch a new version lands on.
 *
 * <p>Saving on top of a version that is no longer the head of its branch would rewrite
 * history, so the edit is moved to a fresh branch forked at that version instead:
 * <pre>
 *   main:   v1 -- v2 -- v3 (head)
 *                  \
 *   fork:           v4          parent v2, not the head, so v4 goes to a new branch
 * </pre>
 * A branch that has no head yet is treated as "head differs" and also forks.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutoBranchPolicy {

    private static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH:mm:ss");

    private final VersionGraphService versionGraph;
    private final ExplainProperties explainProperties;
    private final Clock clock;

    public AutoBranchResult resolve(String branchId, String parentVersionId) {
        if (parentVersionId == null || parentVersionId.isEmpty()) {
            return AutoBranchResult.stay(branchId);
        }

        Optional<Branch> branch = versionGraph.getBranch(branchId);
        if (branch.isEmpty()) {
            return AutoBranchResult.stay(branchId);
        }
        if (branch.get().isHead(parentVersionId)) {
            return AutoBranchResult.stay(branchId);
        }

        String name = explainProperties.getAutoBranchPrefix() + LocalDateTime.now(clock).format(NAME_FORMAT);
        try {
            Branch fork = versionGraph.createBranch(name, branchId, parentVersionId);
            log.info("Auto-branched '{}' from branch {} at version {}", fork.getName(), branchId, parentVersionId);
            return new AutoBranchResult(fork.getId(), fork, true, null);
        } catch (RuntimeException e) {
            log.warn("Auto-branch from {} at {} failed, saving on the original branch: {}",
                    branchId, parentVersionId, e.getMessage(), e);
            return new AutoBranchResult(branchId, null, false,
                    "Could not create a new branch, version saved on the current branch: " + e.getMessage());
        }
    }

    /**
     * @param targetBranchId branch the version should be saved on
     * @param newBranch      the fork, when one was created
     * @param autoBranched   true when {@code newBranch} is set
     * @param warning        set when a fork was needed but could not be created
     */
    public record AutoBranchResult(String targetBranchId, Branch newBranch, boolean autoBranched, String warning) {

        static AutoBranchResult stay(String branchId) {
            return new AutoBranchResult(branchId, null, false, null);
        }
    }
}

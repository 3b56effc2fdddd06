package com.querytuner.model.branch;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Branch - a named line of query edits with a single head version.
 *
 * A branch forked from history remembers both the branch it came from and the exact
 * version it was forked at, so the UI can draw the branch point:
 *
 * <pre>
 *   main:      v1 -- v2 -- v3 (head)
 *                     \
 *   branch-…:          v4 -- v5 (head)      parentBranchId=main, branchFromVersionId=v2
 * </pre>
 *
 * Names are display labels only; two branches may share one.
 */
@Data
@Entity
@Table(name = "BRANCHES", indexes = {
        @Index(name = "idx_branch_name", columnList = "name")
})
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Branch {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    /**
     * Branch this one was forked from. Null for root branches.
     */
    @Column(name = "parent_branch_id", length = 36)
    private String parentBranchId;

    /**
     * Version on the parent branch this branch starts from.
     */
    @Column(name = "branch_from_version_id", length = 36)
    private String branchFromVersionId;

    /**
     * Head version. Null until the first version is saved on this branch.
     */
    @Column(name = "current_version_id", length = 36)
    private String currentVersionId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public boolean hasHead() {
        return currentVersionId != null && !currentVersionId.isEmpty();
    }

    public boolean isHead(String versionId) {
        return hasHead() && currentVersionId.equals(versionId);
    }
}

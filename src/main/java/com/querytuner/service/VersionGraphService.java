package com.querytuner.service;

import com.querytuner.model.branch.Branch;
import com.querytuner.model.branch.QueryVersion;

import java.util.List;
import java.util.Optional;

/**
 * Branches and the immutable versions saved on them.
 */
public interface VersionGraphService {

    /**
     * Create an empty branch.
     *
     * @param parentBranchId      branch this one forks from, null for a root branch
     * @param forkedFromVersionId version the fork starts from, null for a root branch
     */
    Branch createBranch(String name, String parentBranchId, String forkedFromVersionId);

    /**
     * Create a branch and, when {@code withInitialVersion} is set, seed it with a first
     * version holding {@code initialQuery} (or the configured placeholder when blank).
     * A seed failure is logged and the bare branch is returned.
     */
    Branch createBranch(String name, String parentBranchId, String forkedFromVersionId,
                        boolean withInitialVersion, String initialQuery);

    /**
     * All branches, newest first.
     */
    List<Branch> listBranches();

    Optional<Branch> getBranch(String branchId);

    Optional<QueryVersion> getVersion(String versionId);

    /**
     * Insert the version and move its branch head to it, atomically.
     * Missing id and creation time are assigned here. Reusing an existing id is a conflict.
     */
    QueryVersion saveVersion(QueryVersion version);

    /**
     * Versions of a branch, newest first, each carrying its tags.
     */
    List<QueryVersion> getBranchHistory(String branchId);

    /**
     * Create the main branch when no branch with that name exists yet.
     */
    Branch ensureMainBranch();
}

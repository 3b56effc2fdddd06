package com.querytuner.api;

import com.querytuner.exception.NotFoundException;
import com.querytuner.model.branch.Branch;
import com.querytuner.model.branch.QueryVersion;
import com.querytuner.service.TagService;
import com.querytuner.service.VersionGraphService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for branches and their history.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class BranchController {

    private final VersionGraphService versionGraph;
    private final TagService tagService;

    /**
     * GET /api/v1/branches
     */
    @GetMapping("/branches")
    public ResponseEntity<List<Branch>> listBranches() {
        return ResponseEntity.ok(versionGraph.listBranches());
    }

    /**
     * POST /api/v1/branches
     */
    @PostMapping("/branches")
    public ResponseEntity<Branch> createBranch(@Valid @RequestBody CreateBranchRequest request) {
        Branch branch = versionGraph.createBranch(
                request.getName(),
                request.getParentBranchId(),
                request.getBranchFromVersionId(),
                request.isCreateInitialVersion(),
                request.getInitialQuery());
        return ResponseEntity.status(HttpStatus.CREATED).body(branch);
    }

    @GetMapping("/branches/{branchId}")
    public ResponseEntity<Branch> getBranch(@PathVariable String branchId) {
        return versionGraph.getBranch(branchId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("Branch", branchId));
    }

    /**
     * Versions of a branch carrying a tag, e.g. {@code ?tag=perf} or {@code ?tag=env=prod}.
     */
    @GetMapping("/branches/{branchId}/versions")
    public ResponseEntity<List<QueryVersion>> getVersionsByTag(@PathVariable String branchId,
                                                               @RequestParam String tag) {
        return ResponseEntity.ok(tagService.getVersionsByTag(branchId, tag));
    }

    /**
     * GET /api/v1/history?branchId=...
     */
    @GetMapping("/history")
    public ResponseEntity<List<QueryVersion>> getHistory(@RequestParam String branchId) {
        return ResponseEntity.ok(versionGraph.getBranchHistory(branchId));
    }
}

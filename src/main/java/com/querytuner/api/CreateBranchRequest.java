package com.querytuner.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to create a branch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateBranchRequest {

    @NotBlank
    @Size(max = 200)
    private String name;

    private String parentBranchId;

    private String branchFromVersionId;

    /**
     * Seed the branch with a first version.
     */
    private boolean createInitialVersion;

    /**
     * Query text of the seed version. Blank uses the configured placeholder.
     */
    private String initialQuery;
}

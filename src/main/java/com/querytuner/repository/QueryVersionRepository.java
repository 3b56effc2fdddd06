package com.querytuner.repository;

import com.querytuner.model.branch.QueryVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for query versions. Versions are insert-only.
 */
@Repository
public interface QueryVersionRepository extends JpaRepository<QueryVersion, String> {

    /**
     * Branch history, newest first.
     */
    List<QueryVersion> findByBranchIdOrderByCreatedAtDesc(String branchId);

    /**
     * Versions of a branch carrying an exact key/value tag. Simple tags have an empty value.
     */
    @Query("SELECT v FROM QueryVersion v WHERE v.branchId = :branchId AND v.id IN "
            + "(SELECT t.versionId FROM VersionTag t WHERE t.tagKey = :tagKey AND t.tagValue = :tagValue) "
            + "ORDER BY v.createdAt DESC")
    List<QueryVersion> findByBranchIdAndTag(@Param("branchId") String branchId,
                                            @Param("tagKey") String tagKey,
                                            @Param("tagValue") String tagValue);
}

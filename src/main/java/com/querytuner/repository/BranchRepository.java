package com.querytuner.repository;

import com.querytuner.model.branch.Branch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Repository for branches.
 */
@Repository
public interface BranchRepository extends JpaRepository<Branch, String> {

    List<Branch> findAllByOrderByCreatedAtDesc();

    /**
     * Point the branch head at a version.
     *
     * @return number of branch rows updated (0 when the branch does not exist)
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Branch b SET b.currentVersionId = :versionId WHERE b.id = :branchId")
    int advanceHead(@Param("branchId") String branchId, @Param("versionId") String versionId);
}

package com.querytuner.repository;

import com.querytuner.model.tag.VersionTag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for version tags.
 */
@Repository
public interface VersionTagRepository extends JpaRepository<VersionTag, String> {

    List<VersionTag> findByVersionIdOrderByCreatedAtAsc(String versionId);

    /**
     * Bulk lookup used to decorate history listings with one query.
     */
    List<VersionTag> findByVersionIdInOrderByCreatedAtAsc(Collection<String> versionIds);

    boolean existsByVersionIdAndTagKeyAndTagValue(String versionId, String tagKey, String tagValue);

    Optional<VersionTag> findFirstByVersionIdAndTagKey(String versionId, String tagKey);

    /**
     * @return rows deleted
     */
    @Transactional
    @Modifying
    @Query("DELETE FROM VersionTag t WHERE t.id = :id")
    int deleteTagById(@Param("id") String id);
}

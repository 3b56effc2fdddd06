package com.querytuner.service;

import com.querytuner.model.branch.QueryVersion;
import com.querytuner.model.tag.VersionTag;

import java.util.List;

/**
 * Labels on query versions.
 *
 * Tags are written as {@code key} or {@code key=value}. Keys starting with
 * {@code system:} are reserved for flags the application itself sets, such as
 * {@code system:starred}.
 */
public interface TagService {

    /**
     * @throws IllegalArgumentException when the parsed key is empty
     * @throws com.querytuner.exception.NotFoundException when the version does not exist
     * @throws com.querytuner.exception.ConflictException when the version already has this tag
     */
    VersionTag addTag(String versionId, String rawTag);

    /**
     * @throws com.querytuner.exception.NotFoundException when no tag has this id
     */
    void removeTag(String tagId);

    /**
     * Tags of one version, oldest first.
     */
    List<VersionTag> getVersionTags(String versionId);

    /**
     * Versions of a branch carrying the tag, newest first. Key and value match exactly:
     * a bare {@code key} only finds simple tags, never {@code key=value}.
     */
    List<QueryVersion> getVersionsByTag(String branchId, String rawTag);

    /**
     * Flip the starred flag.
     *
     * @return true when the version is starred after this call
     */
    boolean toggleStar(String versionId);
}

package com.querytuner.service.impl;

import com.querytuner.exception.ConflictException;
import com.querytuner.exception.NotFoundException;
import com.querytuner.model.branch.QueryVersion;
import com.querytuner.model.tag.ParsedTag;
import com.querytuner.model.tag.VersionTag;
import com.querytuner.repository.QueryVersionRepository;
import com.querytuner.repository.VersionTagRepository;
import com.querytuner.service.TagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Implementation of TagService.
 *
 * The duplicate check is a read before the insert; the unique constraint on
 * (version, key, value) catches the race between two writers and is reported the same way.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TagServiceImpl implements TagService {

    private final VersionTagRepository tagRepo;
    private final QueryVersionRepository versionRepo;

    @Override
    public VersionTag addTag(String versionId, String rawTag) {
        ParsedTag parsed = ParsedTag.parse(rawTag);
        if (parsed.key().isEmpty()) {
            throw new IllegalArgumentException("Tag key must not be empty");
        }
        if (versionId == null || !versionRepo.existsById(versionId)) {
            throw new NotFoundException("Version", versionId);
        }
        if (tagRepo.existsByVersionIdAndTagKeyAndTagValue(versionId, parsed.key(), parsed.value())) {
            throw new ConflictException("Tag '" + parsed.format() + "' already exists on version " + versionId);
        }

        VersionTag tag = VersionTag.builder()
                .id(UUID.randomUUID().toString())
                .versionId(versionId)
                .tagKey(parsed.key())
                .tagValue(parsed.value())
                .createdAt(LocalDateTime.now())
                .build();

        try {
            VersionTag saved = tagRepo.saveAndFlush(tag);
            log.info("Tagged version {} with '{}'", versionId, saved.formatTag());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Tag '" + parsed.format() + "' already exists on version " + versionId, e);
        }
    }

    @Override
    @Transactional
    public void removeTag(String tagId) {
        int deleted = tagRepo.deleteTagById(tagId);
        if (deleted == 0) {
            throw new NotFoundException("Tag", tagId);
        }
        log.info("Removed tag {}", tagId);
    }

    @Override
    public List<VersionTag> getVersionTags(String versionId) {
        return tagRepo.findByVersionIdOrderByCreatedAtAsc(versionId);
    }

    @Override
    public List<QueryVersion> getVersionsByTag(String branchId, String rawTag) {
        ParsedTag parsed = ParsedTag.parse(rawTag);
        if (parsed.key().isEmpty()) {
            throw new IllegalArgumentException("Tag key must not be empty");
        }
        // a bare key is the empty value, so "env" does not match "env=prod"
        return versionRepo.findByBranchIdAndTag(branchId, parsed.key(), parsed.value());
    }

    @Override
    public boolean toggleStar(String versionId) {
        Optional<VersionTag> star = tagRepo.findFirstByVersionIdAndTagKey(versionId, ParsedTag.STARRED_KEY);
        if (star.isPresent()) {
            removeTag(star.get().getId());
            return false;
        }
        addTag(versionId, ParsedTag.STARRED_KEY);
        return true;
    }
}

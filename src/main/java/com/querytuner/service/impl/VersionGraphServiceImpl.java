package com.querytuner.service.impl;

import com.querytuner.config.ExplainProperties;
import com.querytuner.exception.ConflictException;
import com.querytuner.exception.NotFoundException;
import com.querytuner.model.branch.Branch;
import com.querytuner.model.branch.QueryVersion;
import com.querytuner.model.tag.VersionTag;
import com.querytuner.repository.BranchRepository;
import com.querytuner.repository.QueryVersionRepository;
import com.querytuner.repository.VersionTagRepository;
import com.querytuner.service.VersionGraphService;
import com.querytuner.util.QueryHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Implementation of VersionGraphService.
 *
 * Persists branches and versions to the relational store. Only {@link #saveVersion}
 * spans more than one statement and it runs in a single transaction: the version row
 * and the branch head move together or not at all.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VersionGraphServiceImpl implements VersionGraphService {

    private final BranchRepository branchRepo;
    private final QueryVersionRepository versionRepo;
    private final VersionTagRepository tagRepo;
    private final ExplainProperties explainProperties;
    private final TransactionTemplate transactionTemplate;

    @Override
    public Branch createBranch(String name, String parentBranchId, String forkedFromVersionId) {
        Branch branch = Branch.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .parentBranchId(emptyToNull(parentBranchId))
                .branchFromVersionId(emptyToNull(forkedFromVersionId))
                .createdAt(LocalDateTime.now())
                .build();

        Branch saved = branchRepo.save(branch);
        log.info("Created branch '{}' ({}) parent={} from={}",
                saved.getName(), saved.getId(), saved.getParentBranchId(), saved.getBranchFromVersionId());
        return saved;
    }

    @Override
    public Branch createBranch(String name, String parentBranchId, String forkedFromVersionId,
                               boolean withInitialVersion, String initialQuery) {
        Branch branch = createBranch(name, parentBranchId, forkedFromVersionId);
        if (!withInitialVersion) {
            return branch;
        }

        String query = initialQuery == null || initialQuery.isBlank()
                ? explainProperties.getInitialQuery()
                : initialQuery;

        QueryVersion seed = QueryVersion.builder()
                .branchId(branch.getId())
                .query(query)
                .queryHash(QueryHasher.hash(query))
                .parentVersionId(emptyToNull(forkedFromVersionId))
                .build();
        try {
            // self-invocation skips the @Transactional proxy
            QueryVersion saved = transactionTemplate.execute(status -> saveVersion(seed));
            branch.setCurrentVersionId(saved.getId());
        } catch (RuntimeException e) {
            log.warn("Branch {} created without initial version: {}", branch.getId(), e.getMessage(), e);
        }
        return branch;
    }

    @Override
    public List<Branch> listBranches() {
        return branchRepo.findAllByOrderByCreatedAtDesc();
    }

    @Override
    public Optional<Branch> getBranch(String branchId) {
        if (branchId == null || branchId.isEmpty()) {
            return Optional.empty();
        }
        return branchRepo.findById(branchId);
    }

    @Override
    public Optional<QueryVersion> getVersion(String versionId) {
        if (versionId == null || versionId.isEmpty()) {
            return Optional.empty();
        }
        return versionRepo.findById(versionId);
    }

    @Override
    @Transactional
    public QueryVersion saveVersion(QueryVersion version) {
        QueryVersion toSave = version.toBuilder()
                .id(version.getId() == null ? UUID.randomUUID().toString() : version.getId())
                .createdAt(version.getCreatedAt() == null ? LocalDateTime.now() : version.getCreatedAt())
                .parentVersionId(emptyToNull(version.getParentVersionId()))
                .build();

        if (toSave.hasParent() && !versionRepo.existsById(toSave.getParentVersionId())) {
            throw new IllegalArgumentException("Parent version does not exist: " + toSave.getParentVersionId());
        }

        // an assigned id makes save() merge, and merging onto an @Immutable row is a silent no-op
        if (versionRepo.existsById(toSave.getId())) {
            throw new ConflictException("Version already exists: " + toSave.getId());
        }

        QueryVersion saved = versionRepo.saveAndFlush(toSave);

        int updated = branchRepo.advanceHead(saved.getBranchId(), saved.getId());
        if (updated == 0) {
            // unchecked, so the insert above is rolled back with the transaction
            throw new NotFoundException("Branch", saved.getBranchId());
        }

        log.info("Saved version {} on branch {} (parent={})",
                saved.getId(), saved.getBranchId(), saved.getParentVersionId());
        return saved;
    }

    @Override
    public List<QueryVersion> getBranchHistory(String branchId) {
        List<QueryVersion> versions = versionRepo.findByBranchIdOrderByCreatedAtDesc(branchId);
        attachTags(versions);
        return versions;
    }

    @Override
    @Transactional
    public Branch ensureMainBranch() {
        String mainName = explainProperties.getMainBranchName();
        return branchRepo.findAllByOrderByCreatedAtDesc().stream()
                .filter(b -> mainName.equals(b.getName()))
                .reduce((newer, older) -> older)
                .orElseGet(() -> createBranch(mainName, null, null));
    }

    /**
     * One tag query for the whole listing.
     */
    void attachTags(List<QueryVersion> versions) {
        if (versions.isEmpty()) {
            return;
        }
        List<String> ids = versions.stream().map(QueryVersion::getId).collect(Collectors.toList());
        Map<String, List<VersionTag>> byVersion = tagRepo.findByVersionIdInOrderByCreatedAtAsc(ids).stream()
                .collect(Collectors.groupingBy(VersionTag::getVersionId));

        for (QueryVersion version : versions) {
            version.setTags(new ArrayList<>(byVersion.getOrDefault(version.getId(), List.of())));
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}

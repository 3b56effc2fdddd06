package com.querytuner.service.impl;

import com.querytuner.client.ExplainEngine;
import com.querytuner.exception.ConflictException;
import com.querytuner.exception.NotFoundException;
import com.querytuner.model.branch.Branch;
import com.querytuner.model.branch.QueryVersion;
import com.querytuner.model.tag.ParsedTag;
import com.querytuner.model.tag.VersionTag;
import com.querytuner.repository.BranchRepository;
import com.querytuner.repository.QueryVersionRepository;
import com.querytuner.repository.VersionTagRepository;
import com.querytuner.service.TagService;
import com.querytuner.service.VersionGraphService;
import com.querytuner.util.QueryHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Tag service")
class TagServiceImplTest {

    @MockBean
    private ExplainEngine explainEngine;

    @Autowired
    private TagService tagService;

    @Autowired
    private VersionGraphService versionGraph;

    @Autowired
    private BranchRepository branchRepo;

    @Autowired
    private QueryVersionRepository versionRepo;

    @Autowired
    private VersionTagRepository tagRepo;

    private Branch branch;
    private QueryVersion version;

    @BeforeEach
    void setUp() {
        tagRepo.deleteAllInBatch();
        versionRepo.deleteAllInBatch();
        branchRepo.deleteAllInBatch();

        branch = versionGraph.createBranch("main", null, null);
        version = save("SELECT 1", null);
    }

    private QueryVersion save(String query, String parentId) {
        return versionGraph.saveVersion(QueryVersion.builder()
                .branchId(branch.getId())
                .query(query)
                .queryHash(QueryHasher.hash(query))
                .parentVersionId(parentId)
                .build());
    }

    @Test
    @DisplayName("Tag is stored with parsed key and value")
    void addTag() {
        VersionTag tag = tagService.addTag(version.getId(), " env = prod ");

        assertThat(tag.getId()).isNotBlank();
        assertThat(tag.getTagKey()).isEqualTo("env");
        assertThat(tag.getTagValue()).isEqualTo("prod");
        assertThat(tag.getCreatedAt()).isNotNull();
        assertThat(tagService.getVersionTags(version.getId())).hasSize(1);
    }

    @Test
    @DisplayName("Same tag twice is a conflict")
    void duplicateTag() {
        tagService.addTag(version.getId(), "perf");

        assertThatThrownBy(() -> tagService.addTag(version.getId(), "perf"))
                .isInstanceOf(ConflictException.class);
        assertThat(tagService.getVersionTags(version.getId())).hasSize(1);
    }

    @Test
    @DisplayName("Same key with another value is a different tag")
    void sameKeyOtherValue() {
        tagService.addTag(version.getId(), "env=prod");
        tagService.addTag(version.getId(), "env=dev");
        tagService.addTag(version.getId(), "env");

        assertThat(tagService.getVersionTags(version.getId()))
                .extracting(VersionTag::formatTag)
                .containsExactlyInAnyOrder("env=prod", "env=dev", "env");
    }

    @Test
    @DisplayName("Empty key is rejected")
    void emptyKey() {
        assertThatThrownBy(() -> tagService.addTag(version.getId(), " = value"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tagService.addTag(version.getId(), ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Tagging an unknown version is not found")
    void unknownVersion() {
        assertThatThrownBy(() -> tagService.addTag("missing", "perf"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Removing deletes exactly one tag")
    void removeTag() {
        VersionTag keep = tagService.addTag(version.getId(), "keep");
        VersionTag drop = tagService.addTag(version.getId(), "drop");

        tagService.removeTag(drop.getId());

        assertThat(tagService.getVersionTags(version.getId()))
                .extracting(VersionTag::getId)
                .containsExactly(keep.getId());
    }

    @Test
    @DisplayName("Removing an unknown tag is not found")
    void removeUnknown() {
        assertThatThrownBy(() -> tagService.removeTag("missing"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Version without tags has an empty list")
    void noTags() {
        assertThat(tagService.getVersionTags(version.getId())).isEmpty();
    }

    @Test
    @DisplayName("Star toggles on and off")
    void toggleStar() {
        assertThat(tagService.toggleStar(version.getId())).isTrue();
        assertThat(tagService.getVersionTags(version.getId()))
                .extracting(VersionTag::getTagKey)
                .containsExactly(ParsedTag.STARRED_KEY);
        assertThat(tagService.getVersionTags(version.getId()).get(0).isSystemTag()).isTrue();

        assertThat(tagService.toggleStar(version.getId())).isFalse();
        assertThat(tagService.getVersionTags(version.getId())).isEmpty();
    }

    @Test
    @DisplayName("Star on an unknown version is not found")
    void starUnknown() {
        assertThatThrownBy(() -> tagService.toggleStar("missing"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Versions by tag match key and value exactly")
    void versionsByTag() {
        QueryVersion second = save("SELECT 2", version.getId());
        QueryVersion third = save("SELECT 3", second.getId());
        tagService.addTag(version.getId(), "env=prod");
        tagService.addTag(third.getId(), "env=dev");
        tagService.addTag(second.getId(), "perf");

        List<QueryVersion> bareEnv = tagService.getVersionsByTag(branch.getId(), "env");
        List<QueryVersion> prod = tagService.getVersionsByTag(branch.getId(), "env=prod");

        assertThat(bareEnv).isEmpty();
        assertThat(prod).extracting(QueryVersion::getId).containsExactly(version.getId());
        assertThat(tagService.getVersionsByTag(branch.getId(), "perf")).extracting(QueryVersion::getId)
                .containsExactly(second.getId());

        tagService.addTag(third.getId(), "env");
        assertThat(tagService.getVersionsByTag(branch.getId(), "env")).extracting(QueryVersion::getId)
                .containsExactly(third.getId());
        assertThat(tagService.getVersionsByTag(branch.getId(), "missing")).isEmpty();
    }
}

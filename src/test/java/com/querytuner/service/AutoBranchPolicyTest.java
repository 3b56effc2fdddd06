package com.querytuner.service;

import com.querytuner.config.ExplainProperties;
import com.querytuner.model.branch.Branch;
import com.querytuner.service.AutoBranchPolicy.AutoBranchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Auto-branch policy")
class AutoBranchPolicyTest {

    @Mock
    private VersionGraphService versionGraph;

    private AutoBranchPolicy policy;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(
                LocalDateTime.of(2024, 3, 9, 14, 5, 7).toInstant(ZoneOffset.UTC), ZoneId.of("UTC"));
        policy = new AutoBranchPolicy(versionGraph, new ExplainProperties(), clock);
    }

    private static Branch branch(String head) {
        return Branch.builder().id("b1").name("main").currentVersionId(head).build();
    }

    @Test
    @DisplayName("No parent means no fork")
    void noParent() {
        AutoBranchResult result = policy.resolve("b1", "");

        assertThat(result.autoBranched()).isFalse();
        assertThat(result.targetBranchId()).isEqualTo("b1");
        verify(versionGraph, never()).getBranch(anyString());
    }

    @Test
    @DisplayName("Unknown branch means no fork")
    void unknownBranch() {
        when(versionGraph.getBranch("b1")).thenReturn(Optional.empty());

        AutoBranchResult result = policy.resolve("b1", "v1");

        assertThat(result.autoBranched()).isFalse();
        assertThat(result.targetBranchId()).isEqualTo("b1");
    }

    @Test
    @DisplayName("Editing the head stays on the branch")
    void editingHead() {
        when(versionGraph.getBranch("b1")).thenReturn(Optional.of(branch("v3")));

        AutoBranchResult result = policy.resolve("b1", "v3");

        assertThat(result.autoBranched()).isFalse();
        verify(versionGraph, never()).createBranch(anyString(), any(), any());
    }

    @Test
    @DisplayName("Editing an older version forks with a time-based name")
    void editingHistory() {
        Branch fork = Branch.builder().id("b2").name("branch-2024-03-09-14:05:07").parentBranchId("b1").build();
        when(versionGraph.getBranch("b1")).thenReturn(Optional.of(branch("v3")));
        when(versionGraph.createBranch("branch-2024-03-09-14:05:07", "b1", "v2")).thenReturn(fork);

        AutoBranchResult result = policy.resolve("b1", "v2");

        assertThat(result.autoBranched()).isTrue();
        assertThat(result.targetBranchId()).isEqualTo("b2");
        assertThat(result.newBranch()).isSameAs(fork);
        assertThat(result.warning()).isNull();
    }

    @Test
    @DisplayName("A branch without head forks too")
    void emptyHead() {
        Branch fork = Branch.builder().id("b2").name("x").build();
        when(versionGraph.getBranch("b1")).thenReturn(Optional.of(branch(null)));
        when(versionGraph.createBranch(anyString(), any(), any())).thenReturn(fork);

        AutoBranchResult result = policy.resolve("b1", "v1");

        assertThat(result.autoBranched()).isTrue();
        assertThat(result.targetBranchId()).isEqualTo("b2");
    }

    @Test
    @DisplayName("Fork failure falls back to the original branch with a warning")
    void forkFailure() {
        when(versionGraph.getBranch("b1")).thenReturn(Optional.of(branch("v3")));
        when(versionGraph.createBranch(anyString(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("disk full"));

        AutoBranchResult result = policy.resolve("b1", "v2");

        assertThat(result.autoBranched()).isFalse();
        assertThat(result.targetBranchId()).isEqualTo("b1");
        assertThat(result.newBranch()).isNull();
        assertThat(result.warning()).contains("disk full");
    }
}

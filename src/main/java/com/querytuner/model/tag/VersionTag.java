package com.querytuner.model.tag;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Label attached to a query version. Rows are created and deleted, never updated.
 *
 * <p>Tag value is stored as an empty string rather than NULL so the unique constraint on
 * (version, key, value) also covers simple tags.
 */
@Data
@Entity
@Table(name = "VERSION_TAGS",
        uniqueConstraints = @UniqueConstraint(name = "uk_version_tag",
                columnNames = {"version_id", "tag_key", "tag_value"}),
        indexes = {
                @Index(name = "idx_tags_version", columnList = "version_id"),
                @Index(name = "idx_tags_key_value", columnList = "tag_key, tag_value")
        })
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class VersionTag {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "version_id", nullable = false, length = 36, updatable = false)
    private String versionId;

    @Column(name = "tag_key", nullable = false, length = 200, updatable = false)
    private String tagKey;

    @Builder.Default
    @Column(name = "tag_value", nullable = false, length = 500, updatable = false)
    private String tagValue = "";

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (tagValue == null) {
            tagValue = "";
        }
    }

    public String formatTag() {
        return ParsedTag.format(tagKey, tagValue);
    }

    @JsonIgnore
    public boolean isSystemTag() {
        return ParsedTag.isSystemTag(tagKey);
    }
}

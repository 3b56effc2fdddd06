package com.querytuner.api;

import com.querytuner.exception.NotFoundException;
import com.querytuner.model.branch.QueryVersion;
import com.querytuner.model.tag.VersionTag;
import com.querytuner.service.TagService;
import com.querytuner.service.VersionGraphService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for single versions, their tags and the star flag.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class VersionController {

    private final VersionGraphService versionGraph;
    private final TagService tagService;

    @GetMapping("/versions/{versionId}")
    public ResponseEntity<QueryVersion> getVersion(@PathVariable String versionId) {
        QueryVersion version = versionGraph.getVersion(versionId)
                .orElseThrow(() -> new NotFoundException("Version", versionId));
        version.setTags(tagService.getVersionTags(versionId));
        return ResponseEntity.ok(version);
    }

    @GetMapping("/versions/{versionId}/tags")
    public ResponseEntity<List<VersionTag>> getTags(@PathVariable String versionId) {
        return ResponseEntity.ok(tagService.getVersionTags(versionId));
    }

    @PostMapping("/versions/{versionId}/tags")
    public ResponseEntity<VersionTag> addTag(@PathVariable String versionId,
                                             @Valid @RequestBody AddTagRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tagService.addTag(versionId, request.getTag()));
    }

    /**
     * POST /api/v1/versions/{versionId}/star - returns {@code {"starred": bool}}.
     */
    @PostMapping("/versions/{versionId}/star")
    public ResponseEntity<Map<String, Boolean>> toggleStar(@PathVariable String versionId) {
        return ResponseEntity.ok(Map.of("starred", tagService.toggleStar(versionId)));
    }

    @DeleteMapping("/tags/{tagId}")
    public ResponseEntity<Void> removeTag(@PathVariable String tagId) {
        tagService.removeTag(tagId);
        return ResponseEntity.noContent().build();
    }
}

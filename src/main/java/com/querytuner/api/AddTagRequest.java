package com.querytuner.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to tag a version, as {@code key} or {@code key=value}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddTagRequest {

    @NotBlank
    private String tag;
}

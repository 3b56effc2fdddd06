package com.querytuner.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Engine reachability check.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PingResponse {

    private boolean connected;

    /**
     * Epoch seconds of the check.
     */
    private long timestamp;

    private String error;
}

package com.querytuner.exception;

import lombok.Getter;

/**
 * A branch, version or tag id matched no row.
 */
@Getter
public class NotFoundException extends RuntimeException {

    private final String resource;
    private final String id;

    public NotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }
}

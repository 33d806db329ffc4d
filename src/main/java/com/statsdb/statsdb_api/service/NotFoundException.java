package com.statsdb.statsdb_api.service;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when a handle or name is not in its entity listing.
 */
@Getter
@ResponseStatus(HttpStatus.NOT_FOUND)
public class NotFoundException extends RuntimeException {

    private final String kind;
    private final String name;

    public NotFoundException(String kind, String name) {
        super(kind + " not found: " + name);
        this.kind = kind;
        this.name = name;
    }
}

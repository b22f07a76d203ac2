package com.example.protocolrebuild.api;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a stored protocol revision is not found by id.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class RevisionNotFoundException extends RuntimeException {

    private final UUID revisionId;

    public RevisionNotFoundException(UUID revisionId) {
        super("Revision not found: " + revisionId);
        this.revisionId = revisionId;
    }
}

package com.project.sharestore.core;

import java.nio.file.Path;

/**
 * A link record exists on disk but cannot be parsed or fails validation.
 * Fatal for that record only.
 */
public class CorruptRecordException extends InputValidator.InvalidInputException {

    private final transient Path path;

    public CorruptRecordException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public CorruptRecordException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}

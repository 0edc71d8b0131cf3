package com.cardpack.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when the base template directory is missing a required document or holds malformed JSON.
 */
public class TemplateLoadException extends IOException {
    private final Path source;

    public TemplateLoadException(Path source, String message) {
        super(message + ": " + source);
        this.source = source;
    }

    public TemplateLoadException(Path source, String message, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}

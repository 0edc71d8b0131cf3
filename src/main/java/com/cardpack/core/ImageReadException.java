package com.cardpack.core;

import java.nio.file.Path;

/**
 * A source image could not be read or decoded.
 */
public class ImageReadException extends PackagingException {
    public ImageReadException(String unitName, Path path, String message, Throwable cause) {
        super(unitName, path, message, cause);
    }

    public ImageReadException(String unitName, Path path, String message) {
        super(unitName, path, message);
    }
}

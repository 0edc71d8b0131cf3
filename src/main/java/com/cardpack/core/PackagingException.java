package com.cardpack.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Filesystem failure while staging or sealing one print unit. Only the unit named here is affected;
 * archives already produced by the same batch stay on disk.
 */
public class PackagingException extends IOException {
    private final String unitName;
    private final Path path;

    public PackagingException(String unitName, Path path, String message, Throwable cause) {
        super(describe(unitName, path, message), cause);
        this.unitName = unitName;
        this.path = path;
    }

    public PackagingException(String unitName, Path path, String message) {
        this(unitName, path, message, null);
    }

    private static String describe(String unitName, Path path, String message) {
        String prefix = unitName == null ? "" : "[" + unitName + "] ";
        return prefix + message + (path != null ? ": " + path : "");
    }

    /** Name of the unit being packed, or {@code null} when raised outside a unit. */
    public String getUnitName() {
        return unitName;
    }

    public Path getPath() {
        return path;
    }
}

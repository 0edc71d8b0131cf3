package com.cardpack.core.pack;

import java.util.Objects;

/**
 * Immutable packaging options handed to {@link UnitPackager}.
 *
 * @param archiveExtension extension of the produced archive, without the dot
 * @param identifiers      source of page and image folder names
 */
public record PackagerSettings(String archiveExtension, IdentifierSource identifiers) {
    public static final String DEFAULT_EXTENSION = "etdx";

    public PackagerSettings {
        Objects.requireNonNull(identifiers, "identifiers");
        if (archiveExtension == null || archiveExtension.isBlank() || archiveExtension.contains("/")) {
            throw new IllegalArgumentException("Invalid archive extension: " + archiveExtension);
        }
        archiveExtension = archiveExtension.startsWith(".") ? archiveExtension.substring(1) : archiveExtension;
    }

    public static PackagerSettings defaults() {
        return new PackagerSettings(DEFAULT_EXTENSION, IdentifierSource.RANDOM_UUID);
    }

    public PackagerSettings withIdentifiers(IdentifierSource source) {
        return new PackagerSettings(archiveExtension, source);
    }
}

package com.cardpack.core.pack;

import java.util.Locale;
import java.util.UUID;

/**
 * Mints the page and image folder names used inside an archive.
 */
@FunctionalInterface
public interface IdentifierSource {

    /** Uppercase hyphenated random UUIDs, the form the print software writes itself. */
    IdentifierSource RANDOM_UUID = () -> UUID.randomUUID().toString().toUpperCase(Locale.ROOT);

    String next();
}

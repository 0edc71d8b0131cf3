package com.cardpack.workflow;

/**
 * Where the card faces come from.
 */
public enum SourceMode {
    /** One PDF, one page per card face. */
    PDF,
    /** A folder of PNGs, one per card face, ordered by name. Always packaged. */
    IMAGES
}

package com.cardpack.core.image;

/**
 * Card orientation of the source pages.
 */
public enum Orientation {
    /** 86 x 54 mm, the layout the print template expects. */
    LANDSCAPE,
    /** 54 x 86 mm; pages are turned a quarter counter-clockwise before packaging. */
    PORTRAIT;

    public boolean needsRotation() {
        return this == PORTRAIT;
    }
}

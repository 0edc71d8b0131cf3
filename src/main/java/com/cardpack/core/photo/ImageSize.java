package com.cardpack.core.photo;

/**
 * Pixel dimensions of a source image.
 */
public record ImageSize(int width, int height) {
    public ImageSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image size must be positive: " + width + "x" + height);
        }
    }
}

package com.cardpack.core.photo;

import com.cardpack.core.ImageReadException;

import java.nio.file.Path;

/**
 * Reports the pixel size of an image file without the packager caring how it is decoded.
 */
@FunctionalInterface
public interface ImageProber {
    ImageSize probe(Path image) throws ImageReadException;
}

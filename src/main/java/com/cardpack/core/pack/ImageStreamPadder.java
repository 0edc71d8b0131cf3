package com.cardpack.core.pack;

import com.cardpack.core.ValidationException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Completes a short image stream to a multiple of four by repeating its last two images
 * ({@code ..., x, y} becomes {@code ..., x, y, x, y, x} as far as needed).
 */
public final class ImageStreamPadder {
    private ImageStreamPadder() {
    }

    public static int paddingNeeded(int imageCount) {
        int remainder = imageCount % UnitPackager.IMAGES_PER_UNIT;
        return remainder == 0 ? 0 : UnitPackager.IMAGES_PER_UNIT - remainder;
    }

    /**
     * @return a new list; the input is left untouched
     * @throws ValidationException when padding is needed but fewer than two images exist
     */
    public static List<Path> pad(List<Path> images) {
        List<Path> padded = new ArrayList<>(images);
        int needed = paddingNeeded(images.size());
        if (needed == 0) {
            return padded;
        }
        if (images.size() < 2) {
            throw new ValidationException("Not enough images to pad. Need at least 2 images.");
        }
        List<Path> lastTwo = images.subList(images.size() - 2, images.size());
        for (int i = 0; i < needed; i++) {
            padded.add(lastTwo.get(i % 2));
        }
        return padded;
    }
}

package com.cardpack.core.photo;

import java.util.List;

/**
 * Builds the photo entry for one card face.
 */
public final class PhotoRecordBuilder {

    // Card at 300 DPI: 86mm x 54mm
    public static final int TARGET_WIDTH = 1016;
    public static final int TARGET_HEIGHT = 638;

    public static final List<Double> PHOTO_CENTER = List.of(0.4488523602485657, 0.7050654292106628);
    public static final List<Integer> PHOTO_CROP_RECT = List.of(0, 0, TARGET_WIDTH, TARGET_HEIGHT);

    /** Print software lays out at 360 DPI, rasters are produced at 300 DPI. */
    public static final double DPI_CORRECTION_SCALE = 360.0 / 300.0;

    private PhotoRecordBuilder() {
    }

    /**
     * @param imagePath     path relative to the page folder, {@code <imageId>/<filename>}
     * @param workspaceSlot 1 for the upper card position, 2 for the lower one
     */
    public static PhotoRecord build(String imagePath, int workspaceSlot, ImageSize originalSize) {
        if (workspaceSlot != 1 && workspaceSlot != 2) {
            throw new IllegalArgumentException("Workspace slot must be 1 or 2, got " + workspaceSlot);
        }
        double scale = scaleFor(originalSize.width(), originalSize.height());
        return new PhotoRecord(
            imagePath,
            originalSize.width(),
            originalSize.height(),
            PHOTO_CENTER,
            PHOTO_CROP_RECT,
            scale,
            workspaceSlot
        );
    }

    /**
     * Constant for every input. The print software expects exactly this value for 300 DPI rasters, so it
     * must not become size dependent.
     */
    public static double scaleFor(int width, int height) {
        return DPI_CORRECTION_SCALE;
    }
}

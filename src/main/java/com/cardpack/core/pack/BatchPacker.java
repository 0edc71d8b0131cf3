package com.cardpack.core.pack;

import com.cardpack.core.PackagingException;
import com.cardpack.core.ValidationException;
import com.cardpack.logging.AppLogger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Splits an ordered image stream {@code [F1, B1, F2, B2, F3, B3, ...]} into consecutive groups of four
 * and packs each group as {@code <baseName><n>}, counting from 1.
 *
 * <p>Not transactional: when a group fails the error propagates at once and archives written for
 * earlier groups stay where they are.
 */
public final class BatchPacker {
    private static final Logger LOGGER = AppLogger.get();

    private final UnitPackager packager;

    public BatchPacker(UnitPackager packager) {
        this.packager = Objects.requireNonNull(packager, "packager");
    }

    public List<Path> batchPack(List<Path> images, Path outputDir, String baseName) throws PackagingException {
        if (images == null) {
            throw new ValidationException("Image list is required");
        }
        if (images.size() % UnitPackager.IMAGES_PER_UNIT != 0) {
            throw new ValidationException("Expected multiple of 4 images, got " + images.size());
        }
        if (baseName == null) {
            throw new ValidationException("Base name is required");
        }

        int units = images.size() / UnitPackager.IMAGES_PER_UNIT;
        List<Path> archives = new ArrayList<>(units);
        for (int i = 0; i < units; i++) {
            int from = i * UnitPackager.IMAGES_PER_UNIT;
            List<Path> group = images.subList(from, from + UnitPackager.IMAGES_PER_UNIT);
            archives.add(packager.pack(group, outputDir, unitName(baseName, i)));
        }
        LOGGER.info("Packed " + archives.size() + " unit(s) from " + images.size() + " image(s) into " + outputDir);
        return Collections.unmodifiableList(archives);
    }

    static String unitName(String baseName, int groupIndex) {
        return baseName + (groupIndex + 1);
    }
}

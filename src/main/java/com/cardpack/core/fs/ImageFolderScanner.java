package com.cardpack.core.fs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Collects the card-face PNGs of an image folder in natural name order.
 */
public final class ImageFolderScanner {
    private static final String IMAGE_EXTENSION = ".png";

    public List<Path> findImages(Path folder) throws IOException {
        if (folder == null || !Files.isDirectory(folder)) {
            throw new IOException("Not a folder: " + folder);
        }
        List<Path> images;
        try (Stream<Path> stream = Files.list(folder)) {
            images = stream
                .filter(Files::isRegularFile)
                .filter(p -> hasImageExtension(p.getFileName().toString()))
                .sorted((a, b) -> NaturalOrderComparator.INSTANCE.compare(
                    a.getFileName().toString(), b.getFileName().toString()))
                .collect(Collectors.toList());
        }
        if (images.isEmpty()) {
            throw new IOException("No PNG images found in the selected folder: " + folder);
        }
        return images;
    }

    private boolean hasImageExtension(String filename) {
        return filename.toLowerCase(Locale.ROOT).endsWith(IMAGE_EXTENSION);
    }
}

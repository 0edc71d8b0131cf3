package com.cardpack.core.pack;

import com.cardpack.core.fs.FileTrees;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Staging folder owned by exactly one unit. Creation fails if the folder already exists, and
 * {@link #close()} removes it with everything inside.
 */
final class ScratchDirectory implements AutoCloseable {
    private static final String PREFIX = "_temp_";

    private final Path path;

    private ScratchDirectory(Path path) {
        this.path = path;
    }

    static Path pathFor(Path outputDir, String unitName) {
        return outputDir.resolve(PREFIX + unitName);
    }

    static ScratchDirectory create(Path outputDir, String unitName) throws IOException {
        return new ScratchDirectory(Files.createDirectory(pathFor(outputDir, unitName)));
    }

    Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        FileTrees.deleteTree(path);
    }
}

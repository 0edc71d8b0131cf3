package com.cardpack.core.fs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Recursive copy and delete for staging folders.
 */
public final class FileTrees {
    private FileTrees() {
    }

    public static void copyTree(Path source, Path target) throws IOException {
        List<Path> entries;
        try (Stream<Path> stream = Files.walk(source)) {
            entries = stream.sorted().collect(Collectors.toList());
        }
        for (Path entry : entries) {
            Path destination = target.resolve(source.relativize(entry).toString());
            if (Files.isDirectory(entry)) {
                Files.createDirectories(destination);
            } else {
                Files.createDirectories(destination.getParent());
                Files.copy(entry, destination);
            }
        }
    }

    /**
     * Deletes the tree deepest entries first. Every entry is attempted; the first failure is rethrown at
     * the end with later ones attached as suppressed.
     */
    public static void deleteTree(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> stream = Files.walk(root)) {
            entries = stream.sorted((a, b) -> b.getNameCount() - a.getNameCount()).collect(Collectors.toList());
        }
        IOException failure = null;
        for (Path entry : entries) {
            try {
                Files.deleteIfExists(entry);
            } catch (IOException ex) {
                if (failure == null) {
                    failure = ex;
                } else {
                    failure.addSuppressed(ex);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}

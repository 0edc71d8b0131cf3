package com.cardpack.core.pack;

import com.cardpack.core.TemplateFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ArchiveWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void entriesAreRelativeToTheStagedRootAndDeflated() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("_temp_unit"));
        Files.writeString(root.resolve("page.json"), "[]");
        Files.createDirectories(root.resolve("PAGE/IMG"));
        Files.writeString(root.resolve("PAGE/IMG/a.txt"), "a".repeat(500));
        Files.createDirectories(root.resolve("empty"));
        Path archive = tempDir.resolve("unit.etdx");

        ArchiveWriter.zipTree(root, archive);

        assertEquals(List.of("PAGE/IMG/a.txt", "page.json"), TemplateFixtures.entryNames(archive));
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            assertEquals(ZipEntry.DEFLATED, zip.getEntry("page.json").getMethod());
        }
    }

    @Test
    void failedWriteLeavesNoPartialArchive() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("_temp_unit"));
        Files.writeString(root.resolve("page.json"), "[]");
        Path archive = tempDir.resolve("missing-dir/unit.etdx");

        assertThrows(IOException.class, () -> ArchiveWriter.zipTree(root, archive));
        assertFalse(Files.exists(archive));
    }
}

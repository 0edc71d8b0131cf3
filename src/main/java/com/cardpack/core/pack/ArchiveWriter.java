package com.cardpack.core.pack;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Seals a staged folder into a deflate-compressed ZIP. Entry names are relative to the folder, so the
 * folder itself never shows up inside the archive.
 */
final class ArchiveWriter {
    private ArchiveWriter() {
    }

    /**
     * Writes {@code archive} from the files under {@code root}. A partially written archive is removed
     * before the failure propagates.
     */
    static void zipTree(Path root, Path archive) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.walk(root)) {
            files = stream.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        try (OutputStream out = Files.newOutputStream(archive);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.setMethod(ZipOutputStream.DEFLATED);
            zip.setLevel(Deflater.DEFAULT_COMPRESSION);
            for (Path file : files) {
                zip.putNextEntry(new ZipEntry(entryName(root, file)));
                Files.copy(file, zip);
                zip.closeEntry();
            }
            zip.finish();
        } catch (IOException ex) {
            try {
                Files.deleteIfExists(archive);
            } catch (IOException cleanup) {
                ex.addSuppressed(cleanup);
            }
            throw ex;
        }
    }

    static String entryName(Path root, Path file) {
        StringBuilder name = new StringBuilder();
        for (Path part : root.relativize(file)) {
            if (name.length() > 0) {
                name.append('/');
            }
            name.append(part.toString());
        }
        return name.toString();
    }
}

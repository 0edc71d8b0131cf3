package com.cardpack.core.pack;

import com.cardpack.core.ImageReadException;
import com.cardpack.core.PackagingException;
import com.cardpack.core.ValidationException;
import com.cardpack.core.fs.FileTrees;
import com.cardpack.core.page.PageAssembler;
import com.cardpack.core.page.PageDocument;
import com.cardpack.core.photo.ImageProber;
import com.cardpack.core.photo.ImageSize;
import com.cardpack.core.photo.PhotoRecord;
import com.cardpack.core.photo.PhotoRecordBuilder;
import com.cardpack.core.template.BaseTemplate;
import com.cardpack.logging.AppLogger;
import org.json.JSONArray;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Packs one print unit: two cards, front and back, into a single archive.
 *
 * <p>Input order is {@code front1, back1, front2, back2}. The front page carries both fronts and the
 * back page both backs, card 1 in workspace slot 1 and card 2 in slot 2. Six identifiers are minted
 * per unit: one per page and one per image, the image ones keeping equal filenames apart.
 */
public final class UnitPackager {
    public static final int IMAGES_PER_UNIT = 4;
    public static final String PAGE_MANIFEST_FILENAME = "page.json";

    private static final Logger LOGGER = AppLogger.get();

    private final BaseTemplate template;
    private final PackagerSettings settings;
    private final ImageProber prober;
    private final PageAssembler assembler;

    public UnitPackager(BaseTemplate template, PackagerSettings settings, ImageProber prober) {
        this.template = Objects.requireNonNull(template, "template");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.prober = Objects.requireNonNull(prober, "prober");
        this.assembler = new PageAssembler(template.pageSkeleton());
    }

    public Path archivePathFor(Path outputDir, String unitName) {
        return outputDir.resolve(unitName + "." + settings.archiveExtension());
    }

    /**
     * @return path of the written archive, {@code <outputDir>/<unitName>.<extension>}
     * @throws ValidationException when the input is not exactly four images or the names are unusable
     * @throws ImageReadException  when a source image cannot be decoded
     * @throws PackagingException  on any filesystem failure; no archive and no scratch folder remain
     */
    public Path pack(List<Path> images, Path outputDir, String unitName) throws PackagingException {
        validate(images, outputDir, unitName);

        List<ImageSize> sizes = new ArrayList<>(IMAGES_PER_UNIT);
        for (Path image : images) {
            sizes.add(probe(image, unitName));
        }

        try {
            Files.createDirectories(outputDir);
        } catch (IOException ex) {
            throw new PackagingException(unitName, outputDir, "Could not create output folder", ex);
        }

        Path archive = archivePathFor(outputDir, unitName);
        LOGGER.info("Packing unit " + unitName + " -> " + archive.getFileName());
        try (ScratchDirectory scratch = openScratch(outputDir, unitName)) {
            stage(scratch.path(), images, sizes, unitName);
            seal(scratch.path(), archive, unitName);
        } catch (PackagingException ex) {
            LOGGER.warning("Unit " + unitName + " failed: " + ex.getMessage());
            throw ex;
        } catch (IOException ex) {
            // Only the scratch cleanup can land here; the unit does not count as produced.
            deleteArchive(archive, ex);
            PackagingException failure = new PackagingException(unitName, ScratchDirectory.pathFor(outputDir, unitName),
                "Could not remove scratch directory", ex);
            LOGGER.warning("Unit " + unitName + " failed: " + failure.getMessage());
            throw failure;
        }
        return archive;
    }

    private void validate(List<Path> images, Path outputDir, String unitName) {
        if (images == null || images.size() != IMAGES_PER_UNIT) {
            int count = images == null ? 0 : images.size();
            throw new ValidationException("Expected 4 images: front1, back1, front2, back2 (got " + count + ")");
        }
        for (Path image : images) {
            if (image == null) {
                throw new ValidationException("Image path must not be null");
            }
        }
        if (outputDir == null) {
            throw new ValidationException("Output folder is required");
        }
        if (unitName == null || unitName.isBlank()
            || unitName.contains("/") || unitName.contains("\\") || unitName.equals("..")) {
            throw new ValidationException("Invalid unit name: " + unitName);
        }
    }

    private ImageSize probe(Path image, String unitName) throws ImageReadException {
        try {
            return prober.probe(image);
        } catch (ImageReadException ex) {
            throw new ImageReadException(unitName, image, "Could not read image", ex);
        }
    }

    private static ScratchDirectory openScratch(Path outputDir, String unitName) throws PackagingException {
        Path path = ScratchDirectory.pathFor(outputDir, unitName);
        try {
            return ScratchDirectory.create(outputDir, unitName);
        } catch (FileAlreadyExistsException ex) {
            throw new PackagingException(unitName, path, "Scratch directory already exists, is the same unit being packed elsewhere?", ex);
        } catch (IOException ex) {
            throw new PackagingException(unitName, path, "Could not create scratch directory", ex);
        }
    }

    private void stage(Path root, List<Path> images, List<ImageSize> sizes, String unitName) throws PackagingException {
        IdentifierSource ids = settings.identifiers();
        String frontPageId = ids.next();
        String backPageId = ids.next();

        write(root.resolve(BaseTemplate.PROJECT_INFO_FILENAME), template.projectInfoText(), unitName);
        Path baseData = root.resolve(BaseTemplate.BASE_DATA_DIRNAME);
        try {
            FileTrees.copyTree(template.baseDataDirectory(), baseData);
        } catch (IOException ex) {
            throw new PackagingException(unitName, template.baseDataDirectory(), "Could not copy template assets", ex);
        }
        write(root.resolve(PAGE_MANIFEST_FILENAME), new JSONArray().put(frontPageId).put(backPageId).toString(), unitName);

        stagePage(root, frontPageId, images.get(0), sizes.get(0), images.get(2), sizes.get(2), unitName);
        stagePage(root, backPageId, images.get(1), sizes.get(1), images.get(3), sizes.get(3), unitName);
        LOGGER.fine("Staged unit " + unitName + " front=" + frontPageId + " back=" + backPageId);
    }

    private void stagePage(Path root,
                           String pageId,
                           Path firstImage,
                           ImageSize firstSize,
                           Path secondImage,
                           ImageSize secondSize,
                           String unitName) throws PackagingException {
        Path pageDir = root.resolve(pageId);
        createDirectory(pageDir, unitName);
        PhotoRecord first = stageImage(pageDir, firstImage, firstSize, 1, unitName);
        PhotoRecord second = stageImage(pageDir, secondImage, secondSize, 2, unitName);
        PageDocument page = assembler.assemble(pageId, first, second);
        write(pageDir.resolve(BaseTemplate.PAGE_INFO_FILENAME), page.toJsonString(), unitName);
    }

    private PhotoRecord stageImage(Path pageDir, Path source, ImageSize size, int slot, String unitName)
        throws PackagingException {
        String imageId = settings.identifiers().next();
        Path imageDir = pageDir.resolve(imageId);
        createDirectory(imageDir, unitName);
        String filename = source.getFileName().toString();
        try {
            Files.copy(source, imageDir.resolve(filename));
        } catch (IOException ex) {
            throw new PackagingException(unitName, source, "Could not copy image", ex);
        }
        return PhotoRecordBuilder.build(imageId + "/" + filename, slot, size);
    }

    private static void seal(Path root, Path archive, String unitName) throws PackagingException {
        try {
            ArchiveWriter.zipTree(root, archive);
        } catch (IOException ex) {
            throw new PackagingException(unitName, archive, "Could not write archive", ex);
        }
    }

    private static void createDirectory(Path dir, String unitName) throws PackagingException {
        try {
            Files.createDirectory(dir);
        } catch (IOException ex) {
            throw new PackagingException(unitName, dir, "Could not create folder", ex);
        }
    }

    private static void write(Path file, String content, String unitName) throws PackagingException {
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new PackagingException(unitName, file, "Could not write file", ex);
        }
    }

    private static void deleteArchive(Path archive, IOException cause) {
        try {
            Files.deleteIfExists(archive);
        } catch (IOException ex) {
            cause.addSuppressed(ex);
        }
    }
}

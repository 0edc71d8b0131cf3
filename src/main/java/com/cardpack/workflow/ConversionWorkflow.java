package com.cardpack.workflow;

import com.cardpack.config.ConfigService;
import com.cardpack.core.CardTemplateGenerator;
import com.cardpack.core.fs.FileTrees;
import com.cardpack.core.fs.ImageFolderScanner;
import com.cardpack.core.image.ImageRotator;
import com.cardpack.core.pack.ImageStreamPadder;
import com.cardpack.core.pack.PackagerSettings;
import com.cardpack.core.pdf.PdfPageRasterizer;
import com.cardpack.logging.AppLogger;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs a whole conversion: collect card faces from a PDF or an image folder, rotate portrait cards,
 * pad the stream to full units and package it into .etdx templates.
 */
public final class ConversionWorkflow {
    static final String ROTATED_DIR_NAME = "_temp_rotated";

    private static final Logger LOGGER = AppLogger.get();

    private final Path templateDirectory;
    private final PackagerSettings settings;
    private final PdfPageRasterizer rasterizer;
    private final ImageFolderScanner scanner = new ImageFolderScanner();

    public ConversionWorkflow(Path templateDirectory, PackagerSettings settings, float rasterDpi) {
        this.templateDirectory = Objects.requireNonNull(templateDirectory, "templateDirectory");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.rasterizer = new PdfPageRasterizer(rasterDpi);
    }

    public static ConversionWorkflow fromConfig(ConfigService config) {
        return new ConversionWorkflow(config.getTemplateDirectory(), config.packagerSettings(), config.getRasterDpi());
    }

    public ConversionResult run(ConversionRequest request, ProgressListener listener) throws IOException {
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
        request.validate();

        Path rotatedDir = null;
        try {
            List<Path> images;
            if (request.mode() == SourceMode.PDF) {
                images = rasterizePdf(request, progress);
            } else {
                progress.status("Reading images from folder...");
                images = scanner.findImages(request.input());
                if (request.orientation().needsRotation()) {
                    progress.status("Rotating images for portrait mode...");
                    rotatedDir = createRotatedDir(request.outputDir());
                    images = ImageRotator.rotateAll(images, rotatedDir);
                }
                progress.progress(0.6);
                progress.status("Found " + images.size() + " images...");
            }

            if (!request.packagesTemplates()) {
                progress.progress(1.0);
                progress.status("Successfully converted " + images.size() + " pages!");
                return new ConversionResult(images, List.of(), 0);
            }

            progress.progress(0.7);
            progress.status("Generating ETDX templates...");
            int padding = ImageStreamPadder.paddingNeeded(images.size());
            List<Path> padded = ImageStreamPadder.pad(images);
            if (padding > 0) {
                progress.status("Padded with " + padding + " images to complete template...");
            }

            CardTemplateGenerator generator = CardTemplateGenerator.loadTemplate(templateDirectory, settings);
            List<Path> archives = generator.batchPack(padded, request.outputDir(), request.baseName());

            progress.progress(1.0);
            progress.status("Successfully processed " + padded.size() + " images! Generated "
                + archives.size() + " ETDX template(s).");
            return new ConversionResult(padded, archives, padding);
        } finally {
            if (rotatedDir != null) {
                removeRotatedCopies(rotatedDir);
            }
        }
    }

    private List<Path> rasterizePdf(ConversionRequest request, ProgressListener progress) throws IOException {
        progress.status("Converting pages... (this may take a moment)");
        progress.progress(0.0);
        List<Path> images = rasterizer.rasterize(
            request.input(),
            request.outputDir(),
            request.baseName(),
            request.orientation(),
            (pageNumber, pageCount, image) -> progress.progress(0.7 * pageNumber / pageCount)
        );
        progress.status("Saved " + images.size() + " images...");
        return images;
    }

    /**
     * Creates the rotation folder for this run only; an existing one is left untouched and fails the run.
     */
    private static Path createRotatedDir(Path outputDir) throws IOException {
        Path rotatedDir = outputDir.resolve(ROTATED_DIR_NAME);
        Files.createDirectories(outputDir);
        try {
            return Files.createDirectory(rotatedDir);
        } catch (FileAlreadyExistsException ex) {
            throw new IOException("Rotation folder already exists, remove it or choose another output folder: "
                + rotatedDir, ex);
        }
    }

    private static void removeRotatedCopies(Path rotatedDir) {
        try {
            FileTrees.deleteTree(rotatedDir);
        } catch (IOException ex) {
            LOGGER.warning("Could not remove rotated copies in " + rotatedDir + ": " + ex.getMessage());
        }
    }
}

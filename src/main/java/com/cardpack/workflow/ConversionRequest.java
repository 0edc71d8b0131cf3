package com.cardpack.workflow;

import com.cardpack.core.ValidationException;
import com.cardpack.core.image.Orientation;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One conversion run as chosen by the user.
 *
 * @param generateTemplates package .etdx archives after rasterizing; ignored in {@link SourceMode#IMAGES}
 *                          mode, which always packages
 */
public record ConversionRequest(SourceMode mode,
                                Path input,
                                Path outputDir,
                                Orientation orientation,
                                boolean generateTemplates) {

    public ConversionRequest {
        if (mode == null) {
            throw new ValidationException("Source mode is required");
        }
        if (orientation == null) {
            orientation = Orientation.LANDSCAPE;
        }
    }

    public boolean packagesTemplates() {
        return mode == SourceMode.IMAGES || generateTemplates;
    }

    /** Rejects paths that do not exist before any work starts. */
    void validate() {
        if (input == null || !Files.exists(input)) {
            throw new ValidationException(mode == SourceMode.PDF
                ? "Please select a valid PDF file."
                : "Please select a valid folder.");
        }
        if (mode == SourceMode.PDF && !Files.isRegularFile(input)) {
            throw new ValidationException("Please select a valid PDF file.");
        }
        if (mode == SourceMode.IMAGES && !Files.isDirectory(input)) {
            throw new ValidationException("Please select a valid folder.");
        }
        // Output files are named after the input, which a filesystem root does not have.
        if (input.getFileName() == null) {
            throw new ValidationException("Please select a folder below the filesystem root.");
        }
        if (outputDir == null) {
            throw new ValidationException("Please select an output folder.");
        }
    }

    /** PDF file name without extension, or the image folder's name. */
    String baseName() {
        String name = input.getFileName().toString();
        if (mode == SourceMode.PDF) {
            int dot = name.lastIndexOf('.');
            return dot > 0 ? name.substring(0, dot) : name;
        }
        return name;
    }
}

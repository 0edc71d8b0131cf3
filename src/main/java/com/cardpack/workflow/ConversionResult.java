package com.cardpack.workflow;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a {@link ConversionWorkflow} run. Rotated portrait copies are removed once packaging
 * finishes, so their entries in {@code images} no longer exist on disk afterwards.
 *
 * @param images        card faces in packaging order, padding included
 * @param archives      produced .etdx files in unit order; empty when packaging was not requested
 * @param paddedImages  how many images were repeated to complete the last unit
 */
public record ConversionResult(List<Path> images, List<Path> archives, int paddedImages) {
    public ConversionResult {
        images = List.copyOf(images);
        archives = List.copyOf(archives);
    }
}

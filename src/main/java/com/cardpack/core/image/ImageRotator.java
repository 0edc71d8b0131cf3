package com.cardpack.core.image;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns portrait card faces into the landscape layout of the print template.
 */
public final class ImageRotator {
    private ImageRotator() {
    }

    /**
     * Rotates 90 degrees counter-clockwise; the canvas grows to fit, so width and height swap. Palette
     * images come back as direct colour so no colour is snapped to a default palette.
     */
    public static BufferedImage rotateCounterClockwise(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage rotated = new BufferedImage(height, width, canvasType(source));
        Graphics2D g2d = rotated.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            AffineTransform quarterTurn = new AffineTransform();
            quarterTurn.translate(0, width);
            quarterTurn.quadrantRotate(-1);
            g2d.drawImage(source, quarterTurn, null);
        } finally {
            g2d.dispose();
        }
        return rotated;
    }

    private static int canvasType(BufferedImage source) {
        switch (source.getType()) {
            case BufferedImage.TYPE_CUSTOM:
            case BufferedImage.TYPE_BYTE_INDEXED:
            case BufferedImage.TYPE_BYTE_BINARY:
                return source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
            default:
                return source.getType();
        }
    }

    /**
     * Writes a rotated PNG copy of every image into the existing folder {@code targetDir}, keeping file
     * names.
     *
     * @return the rotated copies, in input order
     */
    public static List<Path> rotateAll(List<Path> images, Path targetDir) throws IOException {
        if (!Files.isDirectory(targetDir)) {
            throw new IOException("Rotation folder does not exist: " + targetDir);
        }
        List<Path> rotated = new ArrayList<>(images.size());
        for (Path image : images) {
            BufferedImage source = ImageIO.read(image.toFile());
            if (source == null) {
                throw new IOException("Unsupported image format: " + image);
            }
            Path target = targetDir.resolve(image.getFileName().toString());
            if (!ImageIO.write(rotateCounterClockwise(source), "png", target.toFile())) {
                throw new IOException("No PNG writer available for " + target);
            }
            rotated.add(target);
        }
        return rotated;
    }
}

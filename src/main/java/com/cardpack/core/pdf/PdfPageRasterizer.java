package com.cardpack.core.pdf;

import com.cardpack.core.image.ImageRotator;
import com.cardpack.core.image.Orientation;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders every page of a card PDF to a PNG at print resolution.
 */
public final class PdfPageRasterizer {

    public interface Listener {
        void onPageSaved(int pageNumber, int pageCount, Path image);
    }

    private final float dpi;

    public PdfPageRasterizer(float dpi) {
        if (dpi <= 0) {
            throw new IllegalArgumentException("DPI must be positive: " + dpi);
        }
        this.dpi = dpi;
    }

    public BufferedImage renderPage(PDDocument document, int pageIndex, Orientation orientation) throws IOException {
        PDFRenderer renderer = new PDFRenderer(document);
        BufferedImage image = renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
        return orientation.needsRotation() ? ImageRotator.rotateCounterClockwise(image) : image;
    }

    /**
     * Saves {@code <baseName>_page_<n>.png} for each page, {@code n} counting from 1.
     *
     * @param listener optional, notified after each page is written
     * @return the written images in page order
     */
    public List<Path> rasterize(Path pdf,
                                Path outputDir,
                                String baseName,
                                Orientation orientation,
                                Listener listener) throws IOException {
        Files.createDirectories(outputDir);
        try (PDDocument document = PDDocument.load(pdf.toFile())) {
            int pageCount = document.getNumberOfPages();
            List<Path> images = new ArrayList<>(pageCount);
            for (int i = 0; i < pageCount; i++) {
                BufferedImage page = renderPage(document, i, orientation);
                Path target = outputDir.resolve(pageFileName(baseName, i + 1));
                if (!ImageIO.write(page, "png", target.toFile())) {
                    throw new IOException("No PNG writer available for " + target);
                }
                images.add(target);
                if (listener != null) {
                    listener.onPageSaved(i + 1, pageCount, target);
                }
            }
            return images;
        }
    }

    public static String pageFileName(String baseName, int pageNumber) {
        return baseName + "_page_" + pageNumber + ".png";
    }
}

package com.cardpack.core.photo;

import com.cardpack.core.ImageReadException;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Reads dimensions from the image header through ImageIO; pixel data is never decoded.
 */
public final class ImageIoProber implements ImageProber {

    @Override
    public ImageSize probe(Path image) throws ImageReadException {
        if (image == null || !Files.isRegularFile(image)) {
            throw new ImageReadException(null, image, "Image file not found");
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(image.toFile())) {
            if (in == null) {
                throw new ImageReadException(null, image, "Image could not be opened");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new ImageReadException(null, image, "Unsupported or corrupt image");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return new ImageSize(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        } catch (IOException | IllegalArgumentException ex) {
            if (ex instanceof ImageReadException) {
                throw (ImageReadException) ex;
            }
            throw new ImageReadException(null, image, "Image could not be read (" + ex.getMessage() + ")", ex);
        }
    }
}

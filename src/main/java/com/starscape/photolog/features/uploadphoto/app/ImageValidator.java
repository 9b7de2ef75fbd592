package com.starscape.photolog.features.uploadphoto.app;

import com.starscape.photolog.common.config.ProcessingProperties;
import com.starscape.photolog.common.exception.ImageValidationException;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

/**
 * Checks uploaded bytes before anything is written: non-empty, within the size limit,
 * an allowed extension, and fully decodable by an installed ImageIO reader.
 */
@Component
public class ImageValidator {

    private final ProcessingProperties processingProperties;

    public ImageValidator(ProcessingProperties processingProperties) {
        this.processingProperties = processingProperties;
    }

    public ValidatedImage validate(byte[] content, String filename) {
        if (content == null || content.length == 0) {
            throw new ImageValidationException("File is empty");
        }
        long maxBytes = processingProperties.getMaxFileSize().toBytes();
        if (content.length > maxBytes) {
            throw new ImageValidationException(
                "File size " + content.length + " exceeds the maximum of " + maxBytes + " bytes");
        }

        String extension = extensionOf(filename);
        if (!processingProperties.isAllowedExtension(extension)) {
            throw new ImageValidationException("Unsupported file type: " + (extension.isEmpty() ? "(none)" : extension));
        }

        return decode(content, extension);
    }

    /**
     * Lower-case extension including the dot, or an empty string when the name has none.
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        if (lastDot < 0 || lastDot == filename.length() - 1) {
            return "";
        }
        return filename.substring(lastDot).toLowerCase(Locale.ROOT);
    }

    private ValidatedImage decode(byte[] content, String extension) {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(content))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new ImageValidationException("Unrecognized image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                BufferedImage image = reader.read(0);
                String format = reader.getFormatName().toLowerCase(Locale.ROOT);
                return new ValidatedImage(extension, "image/" + format, image.getWidth(), image.getHeight());
            } finally {
                reader.dispose();
            }
        } catch (ImageValidationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ImageValidationException("Corrupt or unreadable image: " + e.getMessage(), e);
        }
    }
}

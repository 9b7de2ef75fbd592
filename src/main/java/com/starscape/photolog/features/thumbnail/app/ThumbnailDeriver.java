package com.starscape.photolog.features.thumbnail.app;

import com.starscape.photolog.common.config.ProcessingProperties;
import com.starscape.photolog.common.exception.ImageValidationException;
import com.starscape.photolog.features.thumbnail.domain.DerivedThumbnail;
import com.starscape.photolog.features.thumbnail.domain.ThumbnailPolicy;
import com.starscape.photolog.features.thumbnail.domain.ThumbnailSpec;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.resizers.configurations.Rendering;
import net.coobird.thumbnailator.resizers.configurations.ScalingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders JPEG thumbnails of exactly the requested size.
 * <ul>
 *   <li>{@link ThumbnailPolicy#LETTERBOX}: fit inside the box, centre on white.</li>
 *   <li>{@link ThumbnailPolicy#SMART_CROP}: crop to the box's aspect ratio, then resize.</li>
 * </ul>
 * The source is decoded once per call, rotated according to its EXIF orientation and flattened
 * onto white, so transparent areas come out white in every size.
 */
@Service
public class ThumbnailDeriver {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailDeriver.class);

    private final List<ThumbnailSpec> defaultSpecs;
    private final ThumbnailPolicy defaultPolicy;
    private final float jpegQuality;

    public ThumbnailDeriver(ProcessingProperties processingProperties) {
        this.defaultSpecs = processingProperties.getThumbnailSpecs();
        this.defaultPolicy = processingProperties.getThumbnailPolicy();
        this.jpegQuality = processingProperties.getJpegQuality();
    }

    public List<ThumbnailSpec> defaultSpecs() {
        return defaultSpecs;
    }

    public ThumbnailPolicy defaultPolicy() {
        return defaultPolicy;
    }

    public Map<String, DerivedThumbnail> derive(byte[] imageBytes, List<ThumbnailSpec> specs) {
        return derive(imageBytes, specs, defaultPolicy);
    }

    /**
     * Render every spec from one decoded source.
     *
     * @return thumbnails keyed by spec name, in the order of {@code specs}
     * @throws ImageValidationException if the bytes are not a decodable image; no thumbnails are returned
     */
    public Map<String, DerivedThumbnail> derive(byte[] imageBytes, List<ThumbnailSpec> specs, ThumbnailPolicy policy) {
        BufferedImage source = loadSource(imageBytes);

        Map<String, DerivedThumbnail> thumbnails = new LinkedHashMap<>();
        for (ThumbnailSpec spec : specs) {
            if (thumbnails.containsKey(spec.name())) {
                throw new IllegalArgumentException("Duplicate thumbnail name: " + spec.name());
            }
            thumbnails.put(spec.name(), render(source, spec, policy));
        }
        log.debug("Derived {} thumbnails from {}x{} source", thumbnails.size(), source.getWidth(), source.getHeight());
        return thumbnails;
    }

    public DerivedThumbnail deriveSingle(byte[] imageBytes, ThumbnailSpec spec, ThumbnailPolicy policy) {
        return render(loadSource(imageBytes), spec, policy);
    }

    private DerivedThumbnail render(BufferedImage source, ThumbnailSpec spec, ThumbnailPolicy policy) {
        try {
            BufferedImage image = policy == ThumbnailPolicy.SMART_CROP
                    ? smartCrop(source, spec)
                    : letterbox(source, spec);
            return new DerivedThumbnail(encodeJpeg(image), spec.width(), spec.height());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render thumbnail " + spec.name(), e);
        }
    }

    BufferedImage loadSource(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ImageValidationException("Image data is empty");
        }
        BufferedImage decoded;
        try {
            decoded = Thumbnails.of(new ByteArrayInputStream(imageBytes))
                    .scale(1.0)
                    .useExifOrientation(true)
                    .asBufferedImage();
        } catch (IOException | IllegalArgumentException e) {
            throw new ImageValidationException("Cannot decode image: " + e.getMessage(), e);
        }
        return flattenOntoWhite(decoded);
    }

    /**
     * Scale to fit inside the spec box, keeping aspect ratio, and centre on a white canvas.
     * Scaled dimensions are floored and never below one pixel.
     */
    BufferedImage letterbox(BufferedImage source, ThumbnailSpec spec) throws IOException {
        int sw = source.getWidth();
        int sh = source.getHeight();
        int tw = spec.width();
        int th = spec.height();

        double ratio = Math.min((double) tw / sw, (double) th / sh);
        int nw = Math.min(tw, Math.max(1, (int) Math.floor(sw * ratio)));
        int nh = Math.min(th, Math.max(1, (int) Math.floor(sh * ratio)));

        BufferedImage resized = Thumbnails.of(source)
                .forceSize(nw, nh)
                .scalingMode(ScalingMode.PROGRESSIVE_BILINEAR)
                .rendering(Rendering.QUALITY)
                .asBufferedImage();

        BufferedImage canvas = whiteCanvas(tw, th);
        Graphics2D g = canvas.createGraphics();
        try {
            g.drawImage(resized, (tw - nw) / 2, (th - nh) / 2, null);
        } finally {
            g.dispose();
        }
        return canvas;
    }

    BufferedImage smartCrop(BufferedImage source, ThumbnailSpec spec) throws IOException {
        Rectangle region = cropRegion(source.getWidth(), source.getHeight(), spec.width(), spec.height());
        return Thumbnails.of(source)
                .sourceRegion(region)
                .forceSize(spec.width(), spec.height())
                .scalingMode(ScalingMode.PROGRESSIVE_BILINEAR)
                .rendering(Rendering.QUALITY)
                .asBufferedImage();
    }

    /**
     * Largest region of the source with the target aspect ratio. Wide sources are cropped
     * around the horizontal centre; tall sources keep the upper part, starting one third of the
     * spare height from the top.
     */
    static Rectangle cropRegion(int sourceWidth, int sourceHeight, int targetWidth, int targetHeight) {
        double sourceRatio = (double) sourceWidth / sourceHeight;
        double targetRatio = (double) targetWidth / targetHeight;

        if (sourceRatio > targetRatio) {
            int newWidth = Math.max(1, Math.min(sourceWidth, (int) (sourceHeight * targetRatio)));
            return new Rectangle((sourceWidth - newWidth) / 2, 0, newWidth, sourceHeight);
        }
        int newHeight = Math.max(1, Math.min(sourceHeight, (int) (sourceWidth / targetRatio)));
        return new Rectangle(0, (sourceHeight - newHeight) / 3, sourceWidth, newHeight);
    }

    private byte[] encodeJpeg(BufferedImage image) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        Thumbnails.of(image)
                .scale(1.0)
                .outputFormat("jpg")
                .outputQuality(jpegQuality)
                .toOutputStream(output);
        return output.toByteArray();
    }

    private static BufferedImage flattenOntoWhite(BufferedImage image) {
        BufferedImage rgb = whiteCanvas(image.getWidth(), image.getHeight());
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private static BufferedImage whiteCanvas(int width, int height) {
        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return canvas;
    }
}

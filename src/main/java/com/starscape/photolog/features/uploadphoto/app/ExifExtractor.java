package com.starscape.photolog.features.uploadphoto.app;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.lang.Rational;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.starscape.photolog.features.metadata.domain.ExifInfo;
import com.starscape.photolog.features.metadata.domain.PhotoLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.Date;

/**
 * Reads camera details and GPS position from image metadata.
 */
@Component
public class ExifExtractor {

    private static final Logger log = LoggerFactory.getLogger(ExifExtractor.class);

    /**
     * @param exif null when the image carries no camera data
     * @param location null when the image carries no GPS position
     */
    public record Extracted(ExifInfo exif, PhotoLocation location) {

        static final Extracted NONE = new Extracted(null, null);
    }

    /**
     * Never throws; unreadable metadata yields {@link Extracted#NONE}.
     */
    public Extracted extract(byte[] imageBytes) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(imageBytes));
            return new Extracted(readExif(metadata), readLocation(metadata));
        } catch (ImageProcessingException | IOException e) {
            // EXIF extraction failures are expected for images without metadata
            log.debug("Failed to extract EXIF data: {}", e.getMessage());
            return Extracted.NONE;
        } catch (RuntimeException e) {
            log.warn("Unexpected error while reading image metadata: {}", e.getMessage());
            return Extracted.NONE;
        }
    }

    private ExifInfo readExif(Metadata metadata) {
        String make = null;
        String model = null;
        ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        if (ifd0 != null) {
            make = trimToNull(ifd0.getString(ExifIFD0Directory.TAG_MAKE));
            model = trimToNull(ifd0.getString(ExifIFD0Directory.TAG_MODEL));
        }

        Instant takenAt = null;
        Integer iso = null;
        Double aperture = null;
        String shutterSpeed = null;
        Double focalLength = null;
        ExifSubIFDDirectory sub = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        if (sub != null) {
            Date original = sub.getDateOriginal();
            takenAt = original == null ? null : original.toInstant();
            iso = sub.getInteger(ExifSubIFDDirectory.TAG_ISO_EQUIVALENT);
            aperture = sub.getDoubleObject(ExifSubIFDDirectory.TAG_FNUMBER);
            Rational exposure = sub.getRational(ExifSubIFDDirectory.TAG_EXPOSURE_TIME);
            shutterSpeed = exposure == null ? null : exposure.toSimpleString(true);
            focalLength = sub.getDoubleObject(ExifSubIFDDirectory.TAG_FOCAL_LENGTH);
        }

        ExifInfo exif = new ExifInfo(make, model, takenAt, iso, aperture, shutterSpeed, focalLength);
        return exif.isEmpty() ? null : exif;
    }

    private PhotoLocation readLocation(Metadata metadata) {
        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        if (gps == null) {
            return null;
        }
        GeoLocation geo = gps.getGeoLocation();
        if (geo == null || geo.isZero()) {
            return null;
        }
        return new PhotoLocation(geo.getLatitude(), geo.getLongitude(), null, null, null);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.replace("\u0000", "").trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

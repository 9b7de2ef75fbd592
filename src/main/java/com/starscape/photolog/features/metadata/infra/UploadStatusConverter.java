package com.starscape.photolog.features.metadata.infra;

import com.starscape.photolog.features.metadata.domain.UploadStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists {@link UploadStatus} as its lower-case wire value.
 */
@Converter
public class UploadStatusConverter implements AttributeConverter<UploadStatus, String> {

    @Override
    public String convertToDatabaseColumn(UploadStatus status) {
        return status == null ? null : status.wireValue();
    }

    @Override
    public UploadStatus convertToEntityAttribute(String value) {
        return value == null ? null : UploadStatus.fromWireValue(value);
    }
}

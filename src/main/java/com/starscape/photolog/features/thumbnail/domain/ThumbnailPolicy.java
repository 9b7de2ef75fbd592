package com.starscape.photolog.features.thumbnail.domain;

public enum ThumbnailPolicy {
    /** Fit inside the target box and pad with white. Keeps the whole image. */
    LETTERBOX,
    /** Crop to the target aspect ratio, then resize. Fills the whole box. */
    SMART_CROP
}

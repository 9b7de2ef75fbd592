package com.starscape.photolog.features.metadata.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * @param nextPageToken null on the last page
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PhotoPage(List<PhotoRecord> records, String nextPageToken, long totalCount) {

    public PhotoPage {
        records = List.copyOf(records);
    }

    public static PhotoPage of(List<PhotoRecord> records, PageQuery query, long totalCount) {
        boolean hasMore = (long) query.page() * query.limit() < totalCount;
        return new PhotoPage(records, hasMore ? String.valueOf(query.page() + 1) : null, totalCount);
    }
}

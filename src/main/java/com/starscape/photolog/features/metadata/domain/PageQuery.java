package com.starscape.photolog.features.metadata.domain;

/**
 * One page of a photo listing. Pages are 1-based; {@code limit} is always within 1..100.
 */
public record PageQuery(int limit, int page, PhotoSortField orderBy, SortDirection direction) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    public PageQuery {
        limit = Math.max(1, Math.min(MAX_LIMIT, limit));
        page = Math.max(1, page);
        orderBy = orderBy == null ? PhotoSortField.UPLOAD_TIMESTAMP : orderBy;
        direction = direction == null ? SortDirection.DESC : direction;
    }

    /**
     * Build a query from raw caller input.
     *
     * @param pageToken token returned as {@link PhotoPage#nextPageToken()}, or null for the first page
     * @throws IllegalArgumentException if the page token was not issued by a listing
     */
    public static PageQuery of(Integer limit, String pageToken, String orderBy, String direction) {
        return new PageQuery(
                limit == null ? DEFAULT_LIMIT : limit,
                parsePageToken(pageToken),
                PhotoSortField.resolve(orderBy),
                SortDirection.resolve(direction));
    }

    public static PageQuery firstPage(int limit) {
        return new PageQuery(limit, 1, PhotoSortField.UPLOAD_TIMESTAMP, SortDirection.DESC);
    }

    /**
     * Index of the first row on this page. May exceed any real row count for a large page token.
     */
    public long offset() {
        return (long) (page - 1) * limit;
    }

    private static int parsePageToken(String pageToken) {
        if (pageToken == null || pageToken.isBlank()) {
            return 1;
        }
        try {
            int page = Integer.parseInt(pageToken.trim());
            if (page < 1) {
                throw new IllegalArgumentException("Invalid page token: " + pageToken);
            }
            return page;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid page token: " + pageToken, e);
        }
    }
}

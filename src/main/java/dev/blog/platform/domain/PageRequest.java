package dev.blog.platform.domain;

import lombok.Value;

/**
 * Normalised page window in limit/offset form.
 * Instances are produced by {@link dev.blog.platform.service.PaginationPolicy}, already clamped.
 */
@Value
public class PageRequest {
    long limit;
    long offset;

    /**
     * Convert a 1-based page number into an offset
     */
    public static long offsetOf(long page, long pageSize) {
        return (page - 1) * pageSize;
    }

    /**
     * 1-based page number containing the first row of this window
     */
    public long page() {
        return offset / limit + 1;
    }
}

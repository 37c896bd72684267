package dev.blog.platform.service;

import dev.blog.platform.domain.PageRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Normalises client pagination input.
 * Limit falls back to the default when absent and is clamped to [1, max]; offset is clamped to [0, ∞).
 */
@Component
public class PaginationPolicy {

    private final long defaultLimit;
    private final long maxLimit;

    public PaginationPolicy(@Value("${blog.pagination.default-limit:10}") long defaultLimit,
                            @Value("${blog.pagination.max-limit:100}") long maxLimit) {
        if (maxLimit < 1 || defaultLimit < 1 || defaultLimit > maxLimit) {
            throw new IllegalArgumentException(
                    "Invalid pagination config: default=" + defaultLimit + ", max=" + maxLimit);
        }
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * Limit/offset form used by the HTTP API and the client facade
     */
    public PageRequest fromLimitOffset(Long limit, Long offset) {
        long effectiveLimit = limit == null ? defaultLimit : clamp(limit, 1, maxLimit);
        long effectiveOffset = offset == null ? 0 : Math.max(0, offset);
        return new PageRequest(effectiveLimit, effectiveOffset);
    }

    /**
     * Page/page-size form used on the gRPC wire; pages are 1-based and a zero page size means default
     */
    public PageRequest fromPage(long page, long pageSize) {
        long effectivePage = Math.max(1, page);
        long effectiveSize = pageSize <= 0 ? defaultLimit : Math.min(pageSize, maxLimit);
        return new PageRequest(effectiveSize, PageRequest.offsetOf(effectivePage, effectiveSize));
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }
}

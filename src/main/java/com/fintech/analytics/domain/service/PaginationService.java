package com.fintech.analytics.domain.service;

import com.fintech.analytics.domain.exception.InvalidPaginationException;
import com.fintech.analytics.domain.model.PageRequest;
import com.fintech.analytics.domain.model.PaginatedResponse;
import com.fintech.analytics.domain.model.PaginationMetadata;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Pagination parameter validation and envelope construction.
 *
 * Pages are 1-based. Requesting a page past the end is not an error; it
 * yields an empty data list with the real totals.
 */
@Service
public class PaginationService {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 50;
    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 1000;

    /**
     * @throws InvalidPaginationException if page &lt; 1 or limit is outside [1, 1000]
     */
    public PageRequest validateParams(int page, int limit) {
        if (page < 1) {
            throw new InvalidPaginationException("Page must be >= 1, got " + page);
        }
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw new InvalidPaginationException(
                    String.format("Limit must be between %d and %d, got %d", MIN_LIMIT, MAX_LIMIT, limit));
        }
        return new PageRequest(page, limit);
    }

    public <T> PaginatedResponse<T> buildEnvelope(List<T> items, int page, int limit, long totalCount) {
        long totalPages = (totalCount + limit - 1) / limit;

        PaginationMetadata pagination = PaginationMetadata.builder()
                .page(page)
                .limit(limit)
                .totalCount(totalCount)
                .totalPages(totalPages)
                .hasNextPage(page < totalPages)
                .build();

        return PaginatedResponse.<T>builder()
                .data(items)
                .pagination(pagination)
                .build();
    }

    /**
     * Page of an already ordered result list.
     */
    public <T> PaginatedResponse<T> paginate(List<T> ordered, PageRequest request) {
        int from = (int) Math.min(request.offset(), ordered.size());
        int to = (int) Math.min((long) from + request.getLimit(), ordered.size());
        return buildEnvelope(List.copyOf(ordered.subList(from, to)),
                request.getPage(), request.getLimit(), ordered.size());
    }
}

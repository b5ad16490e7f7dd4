package com.fintech.analytics.domain.model;

import lombok.Value;

/**
 * Validated page coordinates. Page is 1-based.
 */
@Value
public class PageRequest {

    int page;
    int limit;

    public long offset() {
        return (long) (page - 1) * limit;
    }
}

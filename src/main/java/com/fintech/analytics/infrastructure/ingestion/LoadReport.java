package com.fintech.analytics.infrastructure.ingestion;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one bulk load.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadReport {

    private String source;
    /** Rows stored. */
    private int loadedCount;
    /** Rows without an id, dropped silently. */
    private int skippedCount;
    /** Rows that failed to parse. */
    private int errorCount;
}

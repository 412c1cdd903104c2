package com.example.linkservice.dto;

/**
 * Outcome of a bulk write to the edge cache, counted per entry.
 */
public record BulkPutResult(
        int successCount,
        int failedCount
) {

    private static final BulkPutResult EMPTY = new BulkPutResult(0, 0);

    public static BulkPutResult empty() {
        return EMPTY;
    }

    public BulkPutResult plus(BulkPutResult other) {
        return new BulkPutResult(successCount + other.successCount, failedCount + other.failedCount);
    }
}

package com.example.chunker.domain.model;

/**
 * One entry of a batch run: either a successful result or the error that stopped that file.
 */
public record BatchItemResult(
        String filePath,
        StatementChunkResult result,
        String error
) {

    public static BatchItemResult success(String filePath, StatementChunkResult result) {
        return new BatchItemResult(filePath, result, null);
    }

    /**
     * Builds the error record for a failed file. The embedded result is empty and flagged as fallback.
     *
     * @param filePath file that failed
     * @param error    failure message
     * @return error record
     */
    public static BatchItemResult failure(String filePath, String error) {
        return new BatchItemResult(filePath, new StatementChunkResult(ProcessingResult.emptyFallback(), null), error);
    }

    public boolean failed() {
        return error != null;
    }
}

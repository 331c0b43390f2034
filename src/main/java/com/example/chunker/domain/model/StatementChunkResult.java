package com.example.chunker.domain.model;

import java.util.List;

/**
 * Chunking result wrapped with information about the source file.
 * Returned from {@code StatementService} to controllers and batch callers.
 */
public record StatementChunkResult(
        ProcessingResult result,
        FileInfo fileInfo
) {

    public List<String> chunks() {
        return result.chunks();
    }

    public StatementMetadata metadata() {
        return result.metadata();
    }

    public boolean fallbackUsed() {
        return result.fallbackUsed();
    }
}

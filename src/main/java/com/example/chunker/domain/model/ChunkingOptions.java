package com.example.chunker.domain.model;

import com.example.chunker.domain.exception.InvalidChunkingOptionsException;

/**
 * Window parameters for one chunking run.
 *
 * @param chunkSize maximum number of transaction rows per chunk, at least 1
 * @param overlap   rows repeated between consecutive structured chunks, {@code 0 <= overlap < chunkSize}
 */
public record ChunkingOptions(int chunkSize, int overlap) {

    public static final int DEFAULT_CHUNK_SIZE = 5;
    public static final int DEFAULT_OVERLAP = 0;

    public ChunkingOptions {
        if (chunkSize < 1) {
            throw new InvalidChunkingOptionsException("chunkSize must be at least 1 but was " + chunkSize);
        }
        if (overlap < 0) {
            throw new InvalidChunkingOptionsException("overlap must not be negative but was " + overlap);
        }
        if (overlap > 0 && overlap >= chunkSize) {
            throw new InvalidChunkingOptionsException(
                    "overlap (" + overlap + ") must be smaller than chunkSize (" + chunkSize + ")");
        }
    }

    public static ChunkingOptions defaults() {
        return new ChunkingOptions(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }

    /**
     * Applies optional per-request overrides on top of these options.
     *
     * @param chunkSizeOverride replacement chunk size or {@code null}
     * @param overlapOverride   replacement overlap or {@code null}
     * @return validated options
     */
    public ChunkingOptions withOverrides(Integer chunkSizeOverride, Integer overlapOverride) {
        return new ChunkingOptions(
                chunkSizeOverride != null ? chunkSizeOverride : chunkSize,
                overlapOverride != null ? overlapOverride : overlap
        );
    }
}

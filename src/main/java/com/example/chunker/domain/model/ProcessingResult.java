package com.example.chunker.domain.model;

import java.util.List;

/**
 * Outcome of chunking one statement.
 * {@code fallbackUsed} is {@code true} whenever the rows could not be classified reliably and the
 * chunks were produced from unfiltered data.
 */
public record ProcessingResult(
        StatementMetadata metadata,
        List<String> chunks,
        boolean fallbackUsed
) {

    public ProcessingResult {
        metadata = metadata == null ? StatementMetadata.empty() : metadata;
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    /**
     * @return result used when nothing could be extracted at all
     */
    public static ProcessingResult emptyFallback() {
        return new ProcessingResult(StatementMetadata.empty(), List.of(), true);
    }

    public int chunkCount() {
        return chunks.size();
    }
}

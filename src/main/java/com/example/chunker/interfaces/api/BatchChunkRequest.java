package com.example.chunker.interfaces.api;

import java.util.List;

/**
 * JSON body of {@code POST /api/chunks/batch}.
 *
 * @param paths     statement paths on the server
 * @param chunkSize optional chunk size override
 * @param overlap   optional overlap override
 */
public record BatchChunkRequest(
        List<String> paths,
        Integer chunkSize,
        Integer overlap
) {
}

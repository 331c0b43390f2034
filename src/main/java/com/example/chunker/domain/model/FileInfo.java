package com.example.chunker.domain.model;

/**
 * Service-level description of a processed statement file.
 */
public record FileInfo(
        String filePath,
        long fileSizeBytes,
        String fileType,
        int chunkCount,
        PdfDocumentInfo documentInfo
) {
}

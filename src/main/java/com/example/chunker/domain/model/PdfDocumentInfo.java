package com.example.chunker.domain.model;

/**
 * Document-level facts about a PDF statement, taken from its info dictionary and XMP packet.
 * Attached to the file info so callers can tell which bank software produced the export.
 */
public record PdfDocumentInfo(
        String title,
        String author,
        String producer,
        String creatorTool,
        String creationDate,
        int pageCount,
        String pdfVersion,
        boolean encrypted
) {
}

package com.example.chunker.application.service;

import com.example.chunker.domain.model.StatementMetadata;
import com.example.chunker.domain.model.TransactionRow;

import java.util.List;

/**
 * Metadata, header and data rows carved out of a CSV or Excel statement.
 *
 * @param metadata key/value pairs found above the table
 * @param headers  raw header cells
 * @param rows     data rows, each as wide as the header
 */
public record TabularReadResult(
        StatementMetadata metadata,
        List<String> headers,
        List<TransactionRow> rows
) {

    public TabularReadResult {
        metadata = metadata == null ? StatementMetadata.empty() : metadata;
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }
}

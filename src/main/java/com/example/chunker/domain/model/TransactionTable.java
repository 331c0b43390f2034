package com.example.chunker.domain.model;

import java.util.List;

/**
 * Ordered statement rows sharing one {@link HeaderSchema}.
 */
public record TransactionTable(
        HeaderSchema schema,
        List<TransactionRow> rows
) {

    public TransactionTable {
        rows = List.copyOf(rows);
    }

    public List<String> headers() {
        return schema.headers();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}

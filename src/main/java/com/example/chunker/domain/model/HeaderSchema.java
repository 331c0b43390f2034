package com.example.chunker.domain.model;

import java.util.List;

/**
 * Normalized header of a statement table together with the role lookup derived from it.
 * Computed once per document and shared by every page or sheet of that document.
 */
public record HeaderSchema(
        List<String> headers,
        ColumnMap columnMap
) {

    public HeaderSchema {
        headers = List.copyOf(headers);
    }

    public int width() {
        return headers.size();
    }

    /**
     * @param header header name
     * @return column index or {@code -1} when the header is absent
     */
    public int indexOfHeader(String header) {
        return headers.indexOf(header);
    }
}

package com.example.chunker.domain.model;

import java.util.List;

/**
 * Everything the PDF extractor found on a single page.
 *
 * @param pageNumber    one-based page number
 * @param tables        table grids detected on the page, in reading order
 * @param wordRows      words grouped into lines by vertical position, used when no table was found
 * @param nonTableLines text lines outside any table, used as document metadata
 */
public record PdfPageContent(
        int pageNumber,
        List<RawGrid> tables,
        RawGrid wordRows,
        List<String> nonTableLines
) {

    public PdfPageContent {
        tables = tables == null ? List.of() : List.copyOf(tables);
        wordRows = wordRows == null ? RawGrid.empty() : wordRows;
        nonTableLines = nonTableLines == null ? List.of() : List.copyOf(nonTableLines);
    }
}

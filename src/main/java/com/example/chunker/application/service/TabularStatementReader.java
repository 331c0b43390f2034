package com.example.chunker.application.service;

import com.example.chunker.application.structure.CellValues;
import com.example.chunker.application.structure.HeaderLocator;
import com.example.chunker.domain.model.RawGrid;
import com.example.chunker.domain.model.StatementMetadata;
import com.example.chunker.domain.model.TransactionRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Splits CSV and Excel content into metadata, header and data rows.
 * <p>
 * The header-driven split comes in two shapes: {@link #parseMixedLines(List)} for CSV text lines
 * and {@link #parseMixedGrid(RawGrid)} for workbook cells. {@link #readGeneric(RawGrid)} works on a
 * parsed cell grid and takes the first row after a leading {@code key: value} block as the header.
 */
@Component
public class TabularStatementReader {

    private static final Logger log = LoggerFactory.getLogger(TabularStatementReader.class);
    static final int METADATA_SCAN_ROWS = 10;
    private static final List<String> TRANSACTION_INDICATORS = List.of("date", "narration", "debit", "credit");

    /**
     * Line-oriented split. A header-like line starts the table; lines before it that contain a
     * colon or no comma are metadata. A data line with more fields than the header is assumed to
     * carry commas inside the narration: the last {@code headers - 2} fields are kept as trailing
     * columns and the fields between the first and those are re-joined into the narration.
     *
     * @param lines raw text lines
     * @return split content, or empty when no header or no usable data line was found
     */
    public Optional<TabularReadResult> parseMixedLines(List<String> lines) {
        List<String> metadataLines = new ArrayList<>();
        List<String> dataLines = new ArrayList<>();
        String headerLine = null;

        for (String rawLine : lines) {
            String line = rawLine == null ? "" : rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (HeaderLocator.isHeaderLine(line)) {
                headerLine = line;
                continue;
            }
            if (headerLine != null) {
                dataLines.add(line);
            } else if (line.contains(":") || !line.contains(",")) {
                metadataLines.add(line);
            }
        }

        if (headerLine == null || dataLines.isEmpty()) {
            log.debug("Line split found no header or no data lines");
            return Optional.empty();
        }

        List<String> headers = Arrays.stream(headerLine.split(",", -1)).map(String::trim).toList();
        List<TransactionRow> rows = new ArrayList<>();
        for (String line : dataLines) {
            List<String> fields = Arrays.asList(line.split(",", -1));
            if (fields.size() == headers.size()) {
                rows.add(TransactionRow.of(fields));
            } else if (fields.size() > headers.size()) {
                mergeNarrationFields(fields, headers.size()).ifPresent(rows::add);
            }
        }
        StatementMetadata metadata = parseMetadata(metadataLines);
        log.info("Parsed: {} metadata, {} rows", metadata.size(), rows.size());
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TabularReadResult(metadata, headers, rows));
    }

    /**
     * Same split as {@link #parseMixedLines(List)} for sources whose cells are already separated,
     * such as workbook sheets. Cells are never re-split on commas, so formatted amounts like
     * {@code 1,250.00} stay in their column; data rows are padded or cut to the header width.
     *
     * @param grid parsed cells
     * @return split content, or empty when no header or no data row was found
     */
    public Optional<TabularReadResult> parseMixedGrid(RawGrid grid) {
        List<String> metadataLines = new ArrayList<>();
        List<List<String>> dataRows = new ArrayList<>();
        List<String> headerRow = null;

        for (List<String> row : grid.rows()) {
            List<String> values = nonBlank(row);
            if (values.isEmpty()) {
                continue;
            }
            if (HeaderLocator.isHeaderLine(String.join(",", values))) {
                headerRow = row;
                continue;
            }
            if (headerRow != null) {
                dataRows.add(row);
            } else if (values.size() == 1 || values.stream().anyMatch(value -> value.contains(":"))) {
                metadataLines.add(String.join(" ", values));
            }
        }

        if (headerRow == null || dataRows.isEmpty()) {
            log.debug("Grid split found no header or no data rows");
            return Optional.empty();
        }

        List<String> headers = HeaderLocator.headerCells(withoutTrailingBlanks(headerRow));
        List<TransactionRow> rows = new ArrayList<>(dataRows.size());
        for (List<String> row : dataRows) {
            rows.add(TransactionRow.of(row).resize(headers.size()));
        }
        StatementMetadata metadata = parseMetadata(metadataLines);
        log.info("Parsed grid: {} metadata, {} rows", metadata.size(), rows.size());
        return Optional.of(new TabularReadResult(metadata, headers, rows));
    }

    /**
     * Grid-oriented split without validation. Fully blank rows are dropped; among the first rows,
     * those reading as {@code key: value} without commas become metadata until a row mentions a
     * transaction column.
     *
     * @param grid parsed cells
     * @return split content, or empty when the grid holds no data rows
     */
    public Optional<TabularReadResult> readGeneric(RawGrid grid) {
        List<List<String>> rows = new ArrayList<>();
        for (List<String> row : grid.rows()) {
            if (row.stream().anyMatch(CellValues::hasText)) {
                rows.add(row);
            }
        }

        List<String> metadataLines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < Math.min(METADATA_SCAN_ROWS, rows.size()); i++) {
            String text = String.join(" ", nonBlank(rows.get(i)));
            if (text.contains(":") && !text.contains(",")) {
                metadataLines.add(text);
                start = i + 1;
            } else if (containsIndicator(text)) {
                break;
            }
        }

        if (start >= rows.size() - 1) {
            log.warn("Generic read found no data rows below the header");
            return Optional.empty();
        }

        List<String> headers = HeaderLocator.headerCells(rows.get(start));
        List<TransactionRow> dataRows = new ArrayList<>();
        for (List<String> row : rows.subList(start + 1, rows.size())) {
            dataRows.add(TransactionRow.of(row).resize(headers.size()));
        }
        StatementMetadata metadata = parseMetadata(metadataLines);
        log.info("Fallback read: {} rows, {} columns", dataRows.size(), headers.size());
        return Optional.of(new TabularReadResult(metadata, headers, dataRows));
    }

    static StatementMetadata parseMetadata(List<String> metadataLines) {
        StatementMetadata.Builder metadata = StatementMetadata.builder();
        for (String line : metadataLines) {
            int colon = line.indexOf(':');
            if (colon >= 0) {
                metadata.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
            }
        }
        return metadata.build();
    }

    private Optional<TransactionRow> mergeNarrationFields(List<String> fields, int width) {
        int trailing = width - 2;
        if (trailing < 0) {
            return Optional.empty();
        }
        List<String> merged = new ArrayList<>(width);
        merged.add(fields.get(0));
        merged.add(String.join(",", fields.subList(1, fields.size() - trailing)));
        merged.addAll(fields.subList(fields.size() - trailing, fields.size()));
        return Optional.of(TransactionRow.of(merged));
    }

    private static List<String> nonBlank(List<String> row) {
        List<String> values = new ArrayList<>();
        for (String cell : row) {
            if (CellValues.hasText(cell)) {
                values.add(cell.trim());
            }
        }
        return values;
    }

    private static List<String> withoutTrailingBlanks(List<String> row) {
        int end = row.size();
        while (end > 0 && CellValues.isBlank(row.get(end - 1))) {
            end--;
        }
        return row.subList(0, end);
    }

    private static boolean containsIndicator(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return TRANSACTION_INDICATORS.stream().anyMatch(lower::contains);
    }
}

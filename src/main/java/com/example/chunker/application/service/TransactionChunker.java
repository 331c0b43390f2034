package com.example.chunker.application.service;

import com.example.chunker.application.structure.CellValues;
import com.example.chunker.domain.model.ChunkWindow;
import com.example.chunker.domain.model.ChunkingOptions;
import com.example.chunker.domain.model.StatementMetadata;
import com.example.chunker.domain.model.TransactionRow;
import com.example.chunker.domain.model.TransactionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Slices a normalized transaction table into windows and renders each window as a text chunk.
 * <p>
 * Structured mode emits a metadata-only chunk first, then one block per window carrying the
 * metadata, the header, the cleaned rows and the absolute row range. Fallback mode emits flat text
 * blocks and always advances by a full window.
 */
@Component
public class TransactionChunker {

    static final String NULL_MARKER = "null";
    static final String STATEMENT_MARKER = "Statement of account";
    private static final Logger log = LoggerFactory.getLogger(TransactionChunker.class);
    private static final String INDENT = "    ";
    private static final String NESTED_INDENT = "      ";

    /**
     * Builds the structured chunk list for a table whose rows were classified reliably.
     *
     * @param metadata statement metadata, repeated in every data chunk
     * @param table    combined transaction table
     * @param options  window size and overlap
     * @return metadata chunk followed by one chunk per window
     */
    public List<String> chunkStructured(StatementMetadata metadata, TransactionTable table, ChunkingOptions options) {
        List<String> chunks = new ArrayList<>();
        chunks.add(formatMetadata(metadata));

        List<String> headers = table.headers();
        for (ChunkWindow window : ChunkWindow.overlapping(table.size(), options.chunkSize(), options.overlap())) {
            List<List<String>> rows = cleanRows(table.rows().subList(window.start(), window.end()));
            chunks.add(formatStructuredChunk(metadata, headers, rows, window));
            log.debug("Chunk {}: rows {}-{} ({} transactions)",
                    chunks.size() - 1, window.start(), window.lastIndex(), window.size());
        }
        log.info("Created {} structured chunks from {} rows", chunks.size(), table.size());
        return chunks;
    }

    /**
     * Builds flat chunks for rows that could not be classified. Overlap is not applied.
     *
     * @param metadata statement metadata, prepended to every chunk
     * @param headers  header line
     * @param rows     unfiltered rows
     * @param options  window size; the overlap is ignored
     * @return one chunk per window
     */
    public List<String> chunkFallback(StatementMetadata metadata,
                                      List<String> headers,
                                      List<TransactionRow> rows,
                                      ChunkingOptions options) {
        List<String> chunks = new ArrayList<>();
        for (ChunkWindow window : ChunkWindow.contiguous(rows.size(), options.chunkSize())) {
            chunks.add(formatFallbackChunk(metadata, headers, cleanRows(rows.subList(window.start(), window.end()))));
        }
        log.info("Created {} fallback chunks from {} rows", chunks.size(), rows.size());
        return chunks;
    }

    /**
     * Renders one flat block: metadata lines, the statement marker, the header and the rows as
     * space-joined text.
     *
     * @param metadata statement metadata
     * @param headers  header line
     * @param rows     cleaned rows, {@code null} cells allowed
     * @return chunk text
     */
    public String formatFallbackChunk(StatementMetadata metadata, List<String> headers, List<List<String>> rows) {
        List<String> parts = new ArrayList<>();
        if (!metadata.isEmpty()) {
            parts.add(formatMetadata(metadata));
        }
        if (!headers.isEmpty() && !rows.isEmpty()) {
            parts.add(STATEMENT_MARKER);
            parts.add(String.join(" ", headers));
            for (List<String> row : rows) {
                parts.add(row.stream()
                        .map(value -> value == null ? "" : value)
                        .collect(Collectors.joining(" ")));
            }
        }
        return String.join("\n", parts);
    }

    /**
     * @param metadata statement metadata
     * @return one {@code key: value} line per entry
     */
    public String formatMetadata(StatementMetadata metadata) {
        return metadata.asMap().entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining("\n"));
    }

    private String formatStructuredChunk(StatementMetadata metadata,
                                         List<String> headers,
                                         List<List<String>> rows,
                                         ChunkWindow window) {
        List<String> lines = new ArrayList<>();
        lines.add(INDENT + "metadata:");
        for (Map.Entry<String, String> entry : metadata.asMap().entrySet()) {
            lines.add(NESTED_INDENT + quote(entry.getKey()) + ": " + quote(entry.getValue()));
        }
        lines.add(INDENT + "headers[" + headers.size() + "]: " + String.join(",", headers));
        lines.add(INDENT + "rows[" + rows.size() + "]:");
        for (List<String> row : rows) {
            String cells = row.stream()
                    .map(value -> quote(value == null ? NULL_MARKER : value))
                    .collect(Collectors.joining(","));
            lines.add(NESTED_INDENT + "- [" + row.size() + ",]: " + cells);
        }
        lines.add(INDENT + "row_indices[2]: " + window.start() + "," + window.lastIndex());
        lines.add(INDENT + "num_transactions: " + rows.size());
        return String.join("\n", lines);
    }

    private List<List<String>> cleanRows(List<TransactionRow> rows) {
        List<List<String>> cleaned = new ArrayList<>(rows.size());
        for (TransactionRow row : rows) {
            List<String> cells = new ArrayList<>(row.size());
            for (String cell : row.cells()) {
                cells.add(CellValues.clean(cell));
            }
            cleaned.add(cells);
        }
        return cleaned;
    }

    private String quote(String value) {
        return "\"" + value + "\"";
    }
}

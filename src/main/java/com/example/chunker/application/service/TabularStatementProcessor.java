package com.example.chunker.application.service;

import com.example.chunker.application.structure.HeaderNormalizer;
import com.example.chunker.application.structure.RowClassifier;
import com.example.chunker.domain.model.ChunkingOptions;
import com.example.chunker.domain.model.HeaderSchema;
import com.example.chunker.domain.model.HeaderVariant;
import com.example.chunker.domain.model.ProcessingResult;
import com.example.chunker.domain.model.SourceFormat;
import com.example.chunker.domain.model.TransactionRow;
import com.example.chunker.domain.model.TransactionTable;
import com.example.chunker.infrastructure.tabular.TabularFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Chunks CSV and Excel statements.
 * <p>
 * The header-driven split is tried first, on text lines for CSV and on cells for workbooks. Its
 * rows are filtered down to transactions, footer rows excluded. When it finds nothing, the generic grid read is used without filtering. Any failure on
 * the way triggers one last unfiltered grid read before giving up with an empty result.
 */
@Service
public class TabularStatementProcessor {

    private static final Logger log = LoggerFactory.getLogger(TabularStatementProcessor.class);

    private final TabularFileReader fileReader;
    private final TabularStatementReader statementReader;
    private final TransactionChunker chunker;

    public TabularStatementProcessor(TabularFileReader fileReader,
                                     TabularStatementReader statementReader,
                                     TransactionChunker chunker) {
        this.fileReader = fileReader;
        this.statementReader = statementReader;
        this.chunker = chunker;
    }

    /**
     * @param file    CSV or Excel statement
     * @param format  format of {@code file}
     * @param options window settings
     * @return structured or fallback result
     */
    public ProcessingResult process(Path file, SourceFormat format, ChunkingOptions options) {
        log.info("Processing {}: {}", format, file.getFileName());
        try {
            Optional<TabularReadResult> parsed = format.isWorkbook()
                    ? statementReader.parseMixedGrid(fileReader.readTable(file, format))
                    : statementReader.parseMixedLines(fileReader.readLines(file));
            if (parsed.isPresent()) {
                return chunkParsed(parsed.get(), options);
            }
            log.warn("Header split returned no rows for {}, trying generic read", file.getFileName());
            Optional<TabularReadResult> generic = statementReader.readGeneric(fileReader.readTable(file, format));
            if (generic.isEmpty()) {
                log.error("Both readers returned no rows for {}", file.getFileName());
                return ProcessingResult.emptyFallback();
            }
            TabularReadResult read = generic.get();
            HeaderSchema schema = HeaderNormalizer.normalize(read.headers(), HeaderVariant.TABULAR);
            List<String> chunks = chunker.chunkFallback(read.metadata(), schema.headers(), read.rows(), options);
            return new ProcessingResult(read.metadata(), chunks, true);
        } catch (RuntimeException ex) {
            log.error("Processing failed for {}, attempting last resort read", file.getFileName(), ex);
            return lastResort(file, format, options);
        }
    }

    /**
     * Generic grid read chunked with the raw header, no validation.
     *
     * @param file    CSV or Excel statement
     * @param format  format of {@code file}
     * @param options window settings
     * @return fallback result; empty when the read fails or finds no rows
     */
    public ProcessingResult lastResort(Path file, SourceFormat format, ChunkingOptions options) {
        try {
            Optional<TabularReadResult> generic = statementReader.readGeneric(fileReader.readTable(file, format));
            if (generic.isPresent()) {
                TabularReadResult read = generic.get();
                List<String> chunks = chunker.chunkFallback(read.metadata(), read.headers(), read.rows(), options);
                log.info("Last resort: created {} chunks", chunks.size());
                return new ProcessingResult(read.metadata(), chunks, true);
            }
        } catch (RuntimeException ex) {
            log.error("Last resort read failed for {}", file.getFileName(), ex);
        }
        return ProcessingResult.emptyFallback();
    }

    private ProcessingResult chunkParsed(TabularReadResult read, ChunkingOptions options) {
        HeaderSchema schema = HeaderNormalizer.normalize(read.headers(), HeaderVariant.TABULAR);
        log.info("Columns: {}", schema.headers());

        List<TransactionRow> valid = new ArrayList<>();
        for (TransactionRow row : read.rows()) {
            if (!RowClassifier.isFooterRow(row) && RowClassifier.isTransactionRow(row, schema.columnMap())) {
                valid.add(row);
            }
        }
        if (valid.isEmpty()) {
            log.warn("No valid transaction rows found, using all {} rows as fallback", read.rows().size());
            List<String> chunks = chunker.chunkFallback(read.metadata(), schema.headers(), read.rows(), options);
            return new ProcessingResult(read.metadata(), chunks, true);
        }
        log.info("Valid transactions: {}", valid.size());
        List<String> chunks = chunker.chunkStructured(read.metadata(), new TransactionTable(schema, valid), options);
        return new ProcessingResult(read.metadata(), chunks, false);
    }
}

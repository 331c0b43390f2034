package com.example.chunker.application.service;

import com.example.chunker.config.ChunkingProperties;
import com.example.chunker.domain.model.ChunkingOptions;
import com.example.chunker.domain.model.PdfPageContent;
import com.example.chunker.domain.model.ProcessingResult;
import com.example.chunker.domain.model.StatementMetadata;
import com.example.chunker.domain.model.TransactionTable;
import com.example.chunker.infrastructure.pdf.PdfBoxPageExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Chunks PDF statements.
 * <p>
 * Tables are assembled across pages and chunked in structured mode, with the text outside the
 * tables as metadata. When no table survives, or extraction fails, the raw document text is split
 * into overlapping character windows instead.
 */
@Service
public class PdfStatementProcessor {

    private static final Logger log = LoggerFactory.getLogger(PdfStatementProcessor.class);
    static final StatementMetadata TEXT_FALLBACK_METADATA = StatementMetadata.of("source", "text_fallback");
    static final String TEXT_FALLBACK_HEADER = "Content";

    private final PdfBoxPageExtractor pageExtractor;
    private final PdfTableAssembler tableAssembler;
    private final TransactionChunker chunker;
    private final ChunkingProperties properties;

    public PdfStatementProcessor(PdfBoxPageExtractor pageExtractor,
                                 PdfTableAssembler tableAssembler,
                                 TransactionChunker chunker,
                                 ChunkingProperties properties) {
        this.pageExtractor = pageExtractor;
        this.tableAssembler = tableAssembler;
        this.chunker = chunker;
        this.properties = properties;
    }

    /**
     * @param file    PDF statement
     * @param options window settings
     * @return structured result, or the text fallback result
     */
    public ProcessingResult process(Path file, ChunkingOptions options) {
        log.info("Processing PDF: {}", file.getFileName());
        try {
            List<PdfPageContent> pages = pageExtractor.extractPages(file);
            StatementMetadata metadata = nonTableMetadata(pages);
            Optional<TransactionTable> table = tableAssembler.assemble(pages);
            if (table.isEmpty()) {
                log.warn("No transaction table found in {}, using text fallback", file.getFileName());
                return textFallback(file);
            }
            List<String> chunks = chunker.chunkStructured(metadata, table.get(), options);
            return new ProcessingResult(metadata, chunks, false);
        } catch (RuntimeException ex) {
            log.error("PDF processing failed for {}, attempting text fallback", file.getFileName(), ex);
            return textFallback(file);
        }
    }

    /**
     * Splits the raw document text into character windows, one fallback chunk per window.
     *
     * @param file PDF statement
     * @return fallback result; empty when the document has no text
     */
    public ProcessingResult textFallback(Path file) {
        String text = pageExtractor.extractText(file);
        if (text == null || text.isBlank()) {
            log.error("No text could be extracted from {}", file.getFileName());
            return ProcessingResult.emptyFallback();
        }
        ChunkingProperties.TextFallback settings = properties.getTextFallback();
        List<String> pieces = TextSplitter.split(text, settings.getWindow(), settings.getOverlap());
        List<String> chunks = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            chunks.add(chunker.formatFallbackChunk(
                    TEXT_FALLBACK_METADATA, List.of(TEXT_FALLBACK_HEADER), List.of(List.of(piece))));
        }
        log.info("Text fallback created {} chunks from {} characters", chunks.size(), text.length());
        return new ProcessingResult(TEXT_FALLBACK_METADATA, chunks, true);
    }

    static StatementMetadata nonTableMetadata(List<PdfPageContent> pages) {
        StatementMetadata.Builder metadata = StatementMetadata.builder();
        for (PdfPageContent page : pages) {
            if (!page.nonTableLines().isEmpty()) {
                metadata.put("page_" + page.pageNumber(), String.join(" | ", page.nonTableLines()));
            }
        }
        return metadata.build();
    }
}

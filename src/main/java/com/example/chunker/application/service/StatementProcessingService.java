package com.example.chunker.application.service;

import com.example.chunker.domain.exception.StatementNotFoundException;
import com.example.chunker.domain.exception.StatementPathRequiredException;
import com.example.chunker.domain.exception.UnsupportedStatementFormatException;
import com.example.chunker.domain.model.ChunkingOptions;
import com.example.chunker.domain.model.ProcessingResult;
import com.example.chunker.domain.model.SourceFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point of the chunking pipeline: validates the input file and dispatches it to the PDF or
 * tabular processor.
 * Only missing input, missing files and unsupported extensions are reported as exceptions; any
 * other failure ends in an empty fallback result.
 */
@Service
public class StatementProcessingService {

    private static final Logger log = LoggerFactory.getLogger(StatementProcessingService.class);

    private final PdfStatementProcessor pdfProcessor;
    private final TabularStatementProcessor tabularProcessor;
    private final ChunkingOptions defaultOptions;

    public StatementProcessingService(PdfStatementProcessor pdfProcessor,
                                      TabularStatementProcessor tabularProcessor,
                                      ChunkingOptions defaultOptions) {
        this.pdfProcessor = pdfProcessor;
        this.tabularProcessor = tabularProcessor;
        this.defaultOptions = defaultOptions;
    }

    public ProcessingResult process(Path file) {
        return process(file, defaultOptions);
    }

	/**
	 * Chunks one statement file.
	 *
	 * @param file    statement on disk
	 * @param options window settings
	 * @return chunks, metadata and fallback flag
	 * @throws StatementPathRequiredException      when {@code file} is {@code null}
	 * @throws StatementNotFoundException          when the file does not exist
	 * @throws UnsupportedStatementFormatException when the extension is not supported
	 */
    public ProcessingResult process(Path file, ChunkingOptions options) {
        if (file == null) {
            throw new StatementPathRequiredException();
        }
        if (!Files.exists(file)) {
            throw new StatementNotFoundException(file.toString());
        }
        SourceFormat format = SourceFormat.fromPath(file);
        ChunkingOptions effective = options != null ? options : defaultOptions;

        try {
            ProcessingResult result = format == SourceFormat.PDF
                    ? pdfProcessor.process(file, effective)
                    : tabularProcessor.process(file, format, effective);
            log.info("Created {} chunks for {} (fallback={})",
                    result.chunkCount(), file.getFileName(), result.fallbackUsed());
            return result;
        } catch (RuntimeException ex) {
            log.error("Unrecoverable failure while chunking {}", file.getFileName(), ex);
            return ProcessingResult.emptyFallback();
        }
    }

    public ChunkingOptions defaultOptions() {
        return defaultOptions;
    }
}

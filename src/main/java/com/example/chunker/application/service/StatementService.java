package com.example.chunker.application.service;

import com.example.chunker.application.exception.BatchRequestValidationException;
import com.example.chunker.domain.exception.DomainException;
import com.example.chunker.domain.exception.StatementFileRequiredException;
import com.example.chunker.domain.exception.StatementNotFoundException;
import com.example.chunker.domain.exception.StatementPathRequiredException;
import com.example.chunker.domain.model.BatchItemResult;
import com.example.chunker.domain.model.ChunkingOptions;
import com.example.chunker.domain.model.FileInfo;
import com.example.chunker.domain.model.PdfDocumentInfo;
import com.example.chunker.domain.model.ProcessingResult;
import com.example.chunker.domain.model.SourceFormat;
import com.example.chunker.domain.model.StatementChunkResult;
import com.example.chunker.domain.model.StatementMetadata;
import com.example.chunker.infrastructure.exception.InfrastructureException;
import com.example.chunker.infrastructure.exception.StatementReadException;
import com.example.chunker.infrastructure.pdf.PdfBoxDocumentInfoReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Service facade used by the HTTP layer and batch callers.
 * Wraps the pipeline result with information about the source file and isolates failures per file
 * in batch runs.
 */
@Service
public class StatementService {

    private static final Logger log = LoggerFactory.getLogger(StatementService.class);

    private final StatementProcessingService processingService;
    private final PdfBoxDocumentInfoReader documentInfoReader;

    public StatementService(StatementProcessingService processingService,
                            PdfBoxDocumentInfoReader documentInfoReader) {
        this.processingService = processingService;
        this.documentInfoReader = documentInfoReader;
    }

    /**
     * Chunks a statement on disk.
     *
     * @param file      statement path
     * @param chunkSize optional chunk size override
     * @param overlap   optional overlap override
     * @return result with file info
     */
    public StatementChunkResult processFile(Path file, Integer chunkSize, Integer overlap) {
        ChunkingOptions options = processingService.defaultOptions().withOverrides(chunkSize, overlap);
        ProcessingResult result = processingService.process(file, options);
        return new StatementChunkResult(result, describe(file, file.toString(), result));
    }

    public StatementChunkResult processFile(Path file) {
        return processFile(file, null, null);
    }

    /**
     * Chunks an uploaded statement. The upload is copied to a temporary file carrying the original
     * extension, which is removed once processing finishes.
     *
     * @param upload    multipart upload
     * @param chunkSize optional chunk size override
     * @param overlap   optional overlap override
     * @return result whose file info names the uploaded file
     */
    public StatementChunkResult processUpload(MultipartFile upload, Integer chunkSize, Integer overlap) {
        if (upload == null || upload.isEmpty()) {
            throw new StatementFileRequiredException();
        }
        String originalName = upload.getOriginalFilename() != null ? upload.getOriginalFilename() : "upload";
        SourceFormat format = SourceFormat.fromFileName(originalName);
        ChunkingOptions options = processingService.defaultOptions().withOverrides(chunkSize, overlap);

        Path tempFile = null;
        try {
            tempFile = Files.createTempFile("statement-", format.extension());
            upload.transferTo(tempFile);
            ProcessingResult result = processingService.process(tempFile, options);
            return new StatementChunkResult(result, describe(tempFile, originalName, result));
        } catch (IOException ex) {
            throw new StatementReadException("Failed to store upload " + originalName, ex);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    public List<String> getChunksOnly(Path file) {
        return processFile(file).chunks();
    }

    public StatementMetadata getMetadata(Path file) {
        return processFile(file).metadata();
    }

    public boolean isFallbackUsed(Path file) {
        return processFile(file).fallbackUsed();
    }

    /**
     * Processes several files one after another. A file that fails is reported as an error record
     * with an empty result and does not stop the batch.
     *
     * @param filePaths statement paths
     * @param chunkSize optional chunk size override
     * @param overlap   optional overlap override
     * @return one entry per path, in input order
     */
    public List<BatchItemResult> batchProcess(List<String> filePaths, Integer chunkSize, Integer overlap) {
        if (filePaths == null || filePaths.isEmpty()) {
            throw new BatchRequestValidationException("At least one file path is required.");
        }
        ChunkingOptions options = processingService.defaultOptions().withOverrides(chunkSize, overlap);
        List<BatchItemResult> results = new ArrayList<>(filePaths.size());
        for (String filePath : filePaths) {
            try {
                if (filePath == null || filePath.isBlank()) {
                    throw new StatementPathRequiredException();
                }
                Path file = Path.of(filePath);
                ProcessingResult result = processingService.process(file, options);
                results.add(BatchItemResult.success(filePath,
                        new StatementChunkResult(result, describe(file, filePath, result))));
            } catch (DomainException | InfrastructureException ex) {
                log.error("Error processing {}: {}", filePath, ex.getMessage());
                results.add(BatchItemResult.failure(filePath, ex.getMessage()));
            } catch (RuntimeException ex) {
                log.error("Unexpected failure processing {}", filePath, ex);
                results.add(BatchItemResult.failure(filePath, ex.getMessage()));
            }
        }
        long failed = results.stream().filter(BatchItemResult::failed).count();
        log.info("Batch finished: {} files, {} failed", results.size(), failed);
        return results;
    }

    private FileInfo describe(Path file, String displayPath, ProcessingResult result) {
        long size = sizeOf(file);
        String extension = SourceFormat.extensionOf(file);
        PdfDocumentInfo documentInfo = null;
        if (SourceFormat.PDF.extension().equals(extension)) {
            try {
                documentInfo = documentInfoReader.read(file);
            } catch (StatementReadException ex) {
                log.warn("Could not read document info of {}", displayPath, ex);
            }
        }
        return new FileInfo(displayPath, size, extension, result.chunkCount(), documentInfo);
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException ex) {
            log.warn("Could not determine size of {}", file, ex);
            return -1L;
        }
    }

    private void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException ex) {
            log.warn("Failed to delete temporary file {}", tempFile, ex);
        }
    }
}

package com.example.chunker.interfaces.api;

import com.example.chunker.application.service.StatementService;
import com.example.chunker.domain.model.BatchItemResult;
import com.example.chunker.domain.model.StatementChunkResult;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Interfaces-layer REST controller that chunks uploaded statements and server-side batches.
 */
@RestController
@RequestMapping(value = "/api/chunks", produces = MediaType.APPLICATION_JSON_VALUE)
public class StatementChunkController {

    private final StatementService statementService;

    public StatementChunkController(StatementService statementService) {
        this.statementService = statementService;
    }

    /**
     * Chunks one uploaded PDF, CSV or Excel statement.
     *
     * @param file      uploaded statement
     * @param chunkSize optional rows per chunk
     * @param overlap   optional rows shared by consecutive chunks
     * @return chunks, metadata, fallback flag and file info
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<StatementChunkResult> chunkUpload(@RequestParam("file") MultipartFile file,
                                                            @RequestParam(value = "chunkSize", required = false) Integer chunkSize,
                                                            @RequestParam(value = "overlap", required = false) Integer overlap) {
        return ResponseEntity.ok(statementService.processUpload(file, chunkSize, overlap));
    }

    /**
     * Chunks statements already present on the server, one result per path.
     *
     * @param request paths and optional window overrides
     * @return per-file results, failures included
     */
    @PostMapping(value = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<BatchItemResult>> chunkBatch(@RequestBody BatchChunkRequest request) {
        return ResponseEntity.ok(statementService.batchProcess(request.paths(), request.chunkSize(), request.overlap()));
    }
}

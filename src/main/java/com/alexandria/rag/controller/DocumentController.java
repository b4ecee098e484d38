package com.alexandria.rag.controller;

import com.alexandria.rag.model.DocumentMatch;
import com.alexandria.rag.model.IngestionOptions;
import com.alexandria.rag.model.IngestionResult;
import com.alexandria.rag.model.IngestionStats;
import com.alexandria.rag.service.IngestionService;
import com.alexandria.rag.service.RetrievalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final IngestionService ingestionService;
    private final RetrievalService retrievalService;

    @PostMapping("/ingest")
    public ResponseEntity<IngestionResult> ingestFile(@Valid @RequestBody IngestFileRequest request) {
        IngestionResult result = ingestionService.ingestFile(Path.of(request.path()), options(request.options()));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/ingest-dir")
    public ResponseEntity<IngestionResult> ingestDirectory(@Valid @RequestBody IngestDirectoryRequest request) {
        boolean recursive = request.recursive() == null || request.recursive();
        IngestionResult result = ingestionService.ingestDirectory(
            Path.of(request.path()), recursive, options(request.options()));
        return ResponseEntity.ok(result);
    }

    @GetMapping("/stats")
    public ResponseEntity<IngestionStats> stats() {
        return ResponseEntity.ok(ingestionService.getStats());
    }

    @GetMapping("/supported-types")
    public ResponseEntity<List<String>> supportedTypes() {
        return ResponseEntity.ok(ingestionService.supportedExtensions());
    }

    @DeleteMapping("/{hash}")
    public ResponseEntity<Void> delete(@PathVariable String hash) {
        return ingestionService.deleteDocument(hash)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping("/{id}/chunks")
    public ResponseEntity<List<DocumentMatch>> chunks(
        @PathVariable UUID id,
        @RequestParam(name = "max_chunks", defaultValue = "100") int maxChunks) {
        return ResponseEntity.ok(retrievalService.getDocumentChunks(id, maxChunks));
    }

    private IngestionOptions options(IngestOptionsRequest request) {
        IngestionOptions defaults = ingestionService.defaultOptions();
        return request == null ? defaults : request.toOptions(defaults);
    }
}

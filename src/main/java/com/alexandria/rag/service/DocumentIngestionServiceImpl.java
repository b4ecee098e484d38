package com.alexandria.rag.service;

import com.alexandria.rag.chunking.TextChunker;
import com.alexandria.rag.config.ChunkingProperties;
import com.alexandria.rag.config.IngestionProperties;
import com.alexandria.rag.config.SegmentationProperties;
import com.alexandria.rag.exception.SegmentationException;
import com.alexandria.rag.exception.WrongQueryException;
import com.alexandria.rag.model.ChunkRecord;
import com.alexandria.rag.model.ChunkStrategy;
import com.alexandria.rag.model.Document;
import com.alexandria.rag.model.DocumentStatus;
import com.alexandria.rag.model.FileSegment;
import com.alexandria.rag.model.IngestionOptions;
import com.alexandria.rag.model.IngestionResult;
import com.alexandria.rag.model.IngestionStats;
import com.alexandria.rag.model.SourceDocument;
import com.alexandria.rag.model.TextChunk;
import com.alexandria.rag.repository.DocumentChunkRepository;
import com.alexandria.rag.repository.DocumentRepository;
import com.alexandria.rag.segmentation.FileSegmenter;
import com.alexandria.rag.segmentation.SegmentedFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

@Service
@Slf4j
public class DocumentIngestionServiceImpl implements IngestionService {

    public static final String META_SEGMENT_ID = "file_segment_id";
    public static final String META_SEGMENT_INDEX = "file_segment_index";
    public static final String META_ORIGINAL_FILE_SIZE = "original_file_size";

    private final DocumentProcessor documentProcessor;
    private final FileSegmenter fileSegmenter;
    private final TextChunker textChunker;
    private final EmbeddingService embeddingService;
    private final DocumentRepository documentRepository;
    private final DocumentChunkRepository chunkRepository;
    private final TransactionTemplate transactionTemplate;
    private final AsyncTaskExecutor ingestionExecutor;
    private final IngestionProperties ingestionProperties;
    private final SegmentationProperties segmentationProperties;

    // one writer per document hash at a time
    private final ConcurrentHashMap<String, ReentrantLock> documentLocks = new ConcurrentHashMap<>();

    public DocumentIngestionServiceImpl(
        DocumentProcessor documentProcessor,
        FileSegmenter fileSegmenter,
        TextChunker textChunker,
        EmbeddingService embeddingService,
        DocumentRepository documentRepository,
        DocumentChunkRepository chunkRepository,
        TransactionTemplate transactionTemplate,
        @Qualifier("ingestionTaskExecutor") AsyncTaskExecutor ingestionExecutor,
        IngestionProperties ingestionProperties,
        SegmentationProperties segmentationProperties
    ) {
        this.documentProcessor = documentProcessor;
        this.fileSegmenter = fileSegmenter;
        this.textChunker = textChunker;
        this.embeddingService = embeddingService;
        this.documentRepository = documentRepository;
        this.chunkRepository = chunkRepository;
        this.transactionTemplate = transactionTemplate;
        this.ingestionExecutor = ingestionExecutor;
        this.ingestionProperties = ingestionProperties;
        this.segmentationProperties = segmentationProperties;
    }

    @Override
    public IngestionOptions defaultOptions() {
        return IngestionOptions.defaults(ingestionProperties.skipExisting(), ingestionProperties.updateExisting());
    }

    @Override
    public IngestionResult ingestFile(Path file, IngestionOptions options) {
        if (!Files.isRegularFile(file)) {
            throw new WrongQueryException("Not a file: " + file);
        }
        validateOptions(options);
        if (!documentProcessor.isSupported(file)) {
            return new IngestionResult(1, 0, 0, 1, 0,
                List.of("Unsupported file type: " + DocumentProcessor.extensionOf(file)));
        }

        BatchTally tally = new BatchTally(1, ingestionProperties.maxReportedErrors());
        tally.add(processFile(file, options));
        return tally.result();
    }

    @Override
    public IngestionResult ingestDirectory(Path directory, boolean recursive, IngestionOptions options) {
        if (!Files.isDirectory(directory)) {
            throw new WrongQueryException("Not a directory: " + directory);
        }
        validateOptions(options);

        List<Path> files = documentProcessor.scanDirectory(directory, recursive);
        log.info("Found {} supported files in {} (recursive={})", files.size(), directory, recursive);

        List<Future<FileOutcome>> futures = files.stream()
            .map(file -> ingestionExecutor.submit(() -> processFile(file, options)))
            .toList();

        BatchTally tally = new BatchTally(files.size(), ingestionProperties.maxReportedErrors());
        try {
            for (Future<FileOutcome> future : futures) {
                tally.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            int cancelled = cancelPending(futures);
            log.warn("Ingestion of {} interrupted, {} queued documents cancelled", directory, cancelled);
            tally.error("Ingestion interrupted, " + cancelled + " documents not processed");
        } catch (ExecutionException e) {
            cancelPending(futures);
            if (e.getCause() instanceof DataAccessResourceFailureException storeDown) {
                log.error("Store unavailable, aborting ingestion of {}", directory, storeDown);
                throw storeDown;
            }
            throw new IllegalStateException("Ingestion worker failed", e.getCause());
        }

        IngestionResult result = tally.result();
        log.info("Ingested {}: {} processed, {} skipped, {} failed, {} chunks",
            directory, result.processedFiles(), result.skippedFiles(), result.failedFiles(), result.totalChunks());
        return result;
    }

    @Override
    public boolean deleteDocument(String contentHash) {
        boolean deleted = documentRepository.deleteByHash(contentHash);
        if (deleted) {
            log.info("Deleted document {}", contentHash);
        } else {
            log.warn("No document with hash {}", contentHash);
        }
        return deleted;
    }

    @Override
    public IngestionStats getStats() {
        return documentRepository.getStats();
    }

    @Override
    public List<String> supportedExtensions() {
        return documentProcessor.supportedExtensions();
    }

    private void validateOptions(IngestionOptions options) {
        try {
            textChunker.defaults().withOverrides(options);
        } catch (IllegalArgumentException e) {
            throw new WrongQueryException("Invalid chunking options: " + e.getMessage());
        }
    }

    /**
     * Runs one file through the pipeline. Everything except loss of the store connection is
     * turned into a failed outcome so sibling documents carry on.
     */
    private FileOutcome processFile(Path file, IngestionOptions options) {
        try {
            SourceDocument source = documentProcessor.describe(file);
            ReentrantLock lock = documentLocks.computeIfAbsent(source.contentHash(), hash -> new ReentrantLock());
            lock.lock();
            try {
                return ingest(source, options);
            } finally {
                lock.unlock();
            }
        } catch (DataAccessResourceFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to ingest {}: {}", file, e.getMessage(), e);
            return FileOutcome.failed(file + ": " + e.getMessage());
        }
    }

    private FileOutcome ingest(SourceDocument source, IngestionOptions options) {
        Optional<Document> existing = documentRepository.findByHash(source.contentHash());
        if (existing.isPresent() && shouldSkip(existing.get(), source, options)) {
            log.info("Skipping {}, already ingested as {}", source.filename(), existing.get().id());
            return FileOutcome.skipped();
        }

        Map<String, Object> metadata = documentProcessor.documentMetadata(source);
        UUID documentId;
        if (existing.isPresent()) {
            documentId = existing.get().id();
            documentRepository.refresh(documentId, source, metadata);
            log.info("Reprocessing {} ({})", source.filename(), documentId);
        } else {
            documentId = documentRepository.create(source, metadata).id();
            log.info("Created document {} for {}", documentId, source.filename());
        }
        documentRepository.updateStatus(documentId, DocumentStatus.PROCESSING);

        try {
            List<TextChunk> chunks = chunk(source, options);
            List<float[]> vectors = embeddingService.embedAll(chunks.stream().map(TextChunk::content).toList());

            List<ChunkRecord> records = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                records.add(new ChunkRecord(documentId, chunks.get(i), vectors.get(i)));
            }

            DocumentStatus finalStatus = records.isEmpty() ? DocumentStatus.FAILED : DocumentStatus.PROCESSED;
            transactionTemplate.executeWithoutResult(status -> {
                chunkRepository.replaceChunks(documentId, records);
                documentRepository.updateStatus(documentId, finalStatus, records.size());
            });

            if (records.isEmpty()) {
                log.warn("No chunks produced for {}", source.filename());
                return FileOutcome.failed(source.filepath() + ": no chunks produced");
            }
            log.info("Stored {} chunks for {} ({})", records.size(), source.filename(), documentId);
            return FileOutcome.processed(records.size());
        } catch (RuntimeException e) {
            markFailed(documentId, e);
            throw e;
        }
    }

    /**
     * With update-existing, an up-to-date record that has chunks is skipped. Otherwise
     * skip-existing skips any record that has chunks.
     */
    private boolean shouldSkip(Document existing, SourceDocument source, IngestionOptions options) {
        boolean hasChunks = chunkRepository.countByDocumentId(existing.id()) > 0;
        if (options.updateExisting()) {
            boolean upToDate = existing.lastModified() != null
                && !existing.lastModified().isBefore(source.lastModified());
            return hasChunks && upToDate;
        }
        return options.skipExisting() && hasChunks;
    }

    private List<TextChunk> chunk(SourceDocument source, IngestionOptions options) {
        ChunkingProperties config = textChunker.defaults().withOverrides(options);
        ChunkStrategy strategy = textChunker.resolveStrategy(source.contentType(), config, options.chunkStrategy());

        if (!fileSegmenter.shouldSegment(source)) {
            return textChunker.chunk(documentProcessor.extractText(source), strategy, config, 0);
        }

        SegmentedFile segmented;
        try {
            segmented = fileSegmenter.segment(source.path());
        } catch (SegmentationException e) {
            if (!segmentationProperties.fallbackOnError()) {
                throw e;
            }
            log.warn("Segmentation of {} failed, processing it as a whole: {}", source.filename(), e.getMessage());
            return textChunker.chunk(documentProcessor.extractText(source), strategy, config, 0);
        }

        try (segmented) {
            List<TextChunk> chunks = new ArrayList<>();
            for (FileSegment segment : segmented.segments()) {
                String text = documentProcessor.readText(segment.tempFile());
                Map<String, Object> segmentMetadata = segmentMetadata(segment, source);
                textChunker.chunk(text, strategy, config, chunks.size())
                    .forEach(chunk -> chunks.add(chunk.withMetadata(segmentMetadata)));
                log.debug("Segment {} of {} yielded {} chunks so far", segment.index(), source.filename(), chunks.size());
            }
            return chunks;
        }
    }

    private static Map<String, Object> segmentMetadata(FileSegment segment, SourceDocument source) {
        Map<String, Object> metadata = new LinkedHashMap<>(segment.metadata());
        metadata.put(META_SEGMENT_ID, segment.id());
        metadata.put(META_SEGMENT_INDEX, segment.index());
        metadata.put(META_ORIGINAL_FILE_SIZE, source.fileSize());
        return metadata;
    }

    private void markFailed(UUID documentId, RuntimeException cause) {
        try {
            documentRepository.updateStatus(documentId, DocumentStatus.FAILED);
        } catch (DataAccessException e) {
            log.warn("Could not mark document {} as failed: {}", documentId, e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private static int cancelPending(List<Future<FileOutcome>> futures) {
        int cancelled = 0;
        for (Future<FileOutcome> future : futures) {
            if (!future.isDone() && future.cancel(false)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    private enum Outcome {
        PROCESSED,
        SKIPPED,
        FAILED
    }

    private record FileOutcome(Outcome outcome, int chunks, String error) {

        static FileOutcome processed(int chunks) {
            return new FileOutcome(Outcome.PROCESSED, chunks, null);
        }

        static FileOutcome skipped() {
            return new FileOutcome(Outcome.SKIPPED, 0, null);
        }

        static FileOutcome failed(String error) {
            return new FileOutcome(Outcome.FAILED, 0, error);
        }
    }

    private static final class BatchTally {
        private final int totalFiles;
        private final int maxErrors;
        private final List<String> errors = new ArrayList<>();
        private int processed;
        private int skipped;
        private int failed;
        private int chunks;

        BatchTally(int totalFiles, int maxErrors) {
            this.totalFiles = totalFiles;
            this.maxErrors = maxErrors;
        }

        void add(FileOutcome outcome) {
            switch (outcome.outcome()) {
                case PROCESSED -> {
                    processed++;
                    chunks += outcome.chunks();
                }
                case SKIPPED -> skipped++;
                case FAILED -> {
                    failed++;
                    error(outcome.error());
                }
            }
        }

        void error(String message) {
            if (errors.size() < maxErrors) {
                errors.add(message);
            }
        }

        IngestionResult result() {
            return new IngestionResult(totalFiles, processed, skipped, failed, chunks, errors);
        }
    }
}

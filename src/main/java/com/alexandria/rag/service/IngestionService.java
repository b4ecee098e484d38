package com.alexandria.rag.service;

import com.alexandria.rag.model.IngestionOptions;
import com.alexandria.rag.model.IngestionResult;
import com.alexandria.rag.model.IngestionStats;

import java.nio.file.Path;
import java.util.List;

public interface IngestionService {

    IngestionResult ingestFile(Path file, IngestionOptions options);

    /**
     * Ingests every supported file under {@code directory}. Per-file failures are reported in the
     * result; losing the store connection aborts the run.
     */
    IngestionResult ingestDirectory(Path directory, boolean recursive, IngestionOptions options);

    boolean deleteDocument(String contentHash);

    IngestionStats getStats();

    List<String> supportedExtensions();

    IngestionOptions defaultOptions();
}

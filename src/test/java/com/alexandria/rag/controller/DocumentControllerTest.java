package com.alexandria.rag.controller;

import com.alexandria.rag.exception.DocumentNotFoundException;
import com.alexandria.rag.exception.EmbeddingException;
import com.alexandria.rag.model.ChunkStrategy;
import com.alexandria.rag.model.ContentType;
import com.alexandria.rag.model.DocumentMatch;
import com.alexandria.rag.model.DocumentStatus;
import com.alexandria.rag.model.IngestionOptions;
import com.alexandria.rag.model.IngestionResult;
import com.alexandria.rag.model.IngestionStats;
import com.alexandria.rag.service.IngestionService;
import com.alexandria.rag.service.RetrievalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DocumentController.class)
class DocumentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private IngestionService ingestionService;

    @MockitoBean
    private RetrievalService retrievalService;

    @BeforeEach
    void setUp() {
        when(ingestionService.defaultOptions()).thenReturn(IngestionOptions.defaults(true, false));
    }

    @Test
    @DisplayName("POST /documents/ingest should return the ingestion summary")
    void ingestFile_ShouldReturnSummary() throws Exception {
        when(ingestionService.ingestFile(eq(Path.of("/data/notes.md")), any()))
            .thenReturn(new IngestionResult(1, 1, 0, 0, 12, List.of()));

        mockMvc.perform(post("/documents/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"path": "/data/notes.md", "options": {"chunk_strategy": "fixed_size", "chunk_size": 500, "force": true}}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed_files").value(1))
            .andExpect(jsonPath("$.total_chunks").value(12));

        ArgumentCaptor<IngestionOptions> options = ArgumentCaptor.forClass(IngestionOptions.class);
        verify(ingestionService).ingestFile(eq(Path.of("/data/notes.md")), options.capture());
        assertThat(options.getValue().chunkStrategy()).contains(ChunkStrategy.FIXED_SIZE);
        assertThat(options.getValue().maxChunkSize()).contains(500);
        assertThat(options.getValue().skipExisting()).isFalse();
    }

    @Test
    @DisplayName("POST /documents/ingest should reject a blank path")
    void ingestFile_ShouldReturn400_WhenPathBlank() throws Exception {
        mockMvc.perform(post("/documents/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    @DisplayName("POST /documents/ingest-dir should be recursive by default")
    void ingestDirectory_ShouldDefaultToRecursive() throws Exception {
        when(ingestionService.ingestDirectory(any(), eq(true), any()))
            .thenReturn(new IngestionResult(3, 2, 0, 1, 20, List.of("/data/bad.txt: quota")));

        mockMvc.perform(post("/documents/ingest-dir")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"/data\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.failed_files").value(1))
            .andExpect(jsonPath("$.errors[0]").value("/data/bad.txt: quota"));
    }

    @Test
    @DisplayName("Embedding provider failures map to 502")
    void ingestFile_ShouldReturn502_WhenProviderFails() throws Exception {
        when(ingestionService.ingestFile(any(), any())).thenThrow(new EmbeddingException("Embedding provider failed: quota"));

        mockMvc.perform(post("/documents/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"/data/notes.md\"}"))
            .andExpect(status().isBadGateway());
    }

    @Test
    @DisplayName("GET /documents/stats should return counts by status and content type")
    void stats_ShouldReturnCounts() throws Exception {
        when(ingestionService.getStats()).thenReturn(new IngestionStats(
            Map.of(DocumentStatus.PROCESSED, 4L), Map.of(ContentType.MARKDOWN, 4L), 40));

        mockMvc.perform(get("/documents/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.document_stats.PROCESSED").value(4))
            .andExpect(jsonPath("$.total_chunks").value(40));
    }

    @Test
    @DisplayName("GET /documents/supported-types should list extensions")
    void supportedTypes_ShouldListExtensions() throws Exception {
        when(ingestionService.supportedExtensions()).thenReturn(List.of(".txt", ".md"));

        mockMvc.perform(get("/documents/supported-types"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[1]").value(".md"));
    }

    @Test
    @DisplayName("DELETE /documents/{hash} should return 204 or 404")
    void delete_ShouldReflectOutcome() throws Exception {
        when(ingestionService.deleteDocument("abc")).thenReturn(true);
        when(ingestionService.deleteDocument("missing")).thenReturn(false);

        mockMvc.perform(delete("/documents/{hash}", "abc")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/documents/{hash}", "missing")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /documents/{id}/chunks should return chunks in order")
    void chunks_ShouldReturnChunks() throws Exception {
        UUID documentId = UUID.randomUUID();
        DocumentMatch chunk = new DocumentMatch(UUID.randomUUID(), documentId, 0, "First chunk", 0.0,
            "notes.md", "/data/notes.md", ContentType.MARKDOWN, Map.of(), OffsetDateTime.now());
        when(retrievalService.getDocumentChunks(documentId, 5)).thenReturn(List.of(chunk));

        mockMvc.perform(get("/documents/{id}/chunks", documentId).param("max_chunks", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].chunk_index").value(0))
            .andExpect(jsonPath("$[0].content").value("First chunk"));
    }

    @Test
    @DisplayName("GET /documents/{id}/chunks should return 404 for unknown documents")
    void chunks_ShouldReturn404_WhenDocumentMissing() throws Exception {
        UUID documentId = UUID.randomUUID();
        when(retrievalService.getDocumentChunks(documentId, 100)).thenThrow(new DocumentNotFoundException(documentId));

        mockMvc.perform(get("/documents/{id}/chunks", documentId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Document not found: " + documentId));
    }
}

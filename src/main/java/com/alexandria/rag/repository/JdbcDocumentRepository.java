package com.alexandria.rag.repository;

import com.alexandria.rag.exception.DocumentNotFoundException;
import com.alexandria.rag.model.ContentType;
import com.alexandria.rag.model.Document;
import com.alexandria.rag.model.DocumentStatus;
import com.alexandria.rag.model.IngestionStats;
import com.alexandria.rag.model.SourceDocument;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentRepository implements DocumentRepository {

    private final JdbcClient jdbcClient;
    private final JsonbMapper jsonbMapper;

    private RowMapper<Document> documentRowMapper() {
        return (rs, rowNum) -> new Document(
            rs.getObject("id", UUID.class),
            rs.getString("filename"),
            rs.getString("filepath"),
            rs.getString("content_hash"),
            rs.getLong("file_size"),
            rs.getString("mime_type"),
            ContentType.valueOf(rs.getString("content_type")),
            DocumentStatus.valueOf(rs.getString("status")),
            rs.getInt("chunk_count"),
            jsonbMapper.read(rs.getString("metadata")),
            rs.getObject("last_modified", OffsetDateTime.class),
            rs.getObject("created_at", OffsetDateTime.class),
            rs.getObject("updated_at", OffsetDateTime.class)
        );
    }

    @Override
    public Optional<Document> findByHash(String contentHash) {
        return jdbcClient.sql("SELECT * FROM documents WHERE content_hash = :hash")
            .param("hash", contentHash)
            .query(documentRowMapper())
            .optional();
    }

    @Override
    public Optional<Document> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper())
            .optional();
    }

    @Override
    public Document create(SourceDocument source, Map<String, Object> metadata) {
        return jdbcClient.sql("""
                INSERT INTO documents (filename, filepath, content_hash, file_size, mime_type, content_type,
                                       status, metadata, last_modified)
                VALUES (:filename, :filepath, :hash, :size, :mimeType, :contentType,
                        'PENDING', CAST(:metadata AS jsonb), :lastModified)
                RETURNING *
                """)
            .param("filename", source.filename())
            .param("filepath", source.filepath())
            .param("hash", source.contentHash())
            .param("size", source.fileSize())
            .param("mimeType", source.mimeType())
            .param("contentType", source.contentType().name())
            .param("metadata", jsonbMapper.write(metadata))
            .param("lastModified", source.lastModified())
            .query(documentRowMapper())
            .single();
    }

    @Override
    public void refresh(UUID id, SourceDocument source, Map<String, Object> metadata) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE documents
                SET filename = :filename,
                    filepath = :filepath,
                    file_size = :size,
                    mime_type = :mimeType,
                    content_type = :contentType,
                    metadata = CAST(:metadata AS jsonb),
                    last_modified = :lastModified,
                    updated_at = NOW()
                WHERE id = :id
                """)
            .param("filename", source.filename())
            .param("filepath", source.filepath())
            .param("size", source.fileSize())
            .param("mimeType", source.mimeType())
            .param("contentType", source.contentType().name())
            .param("metadata", jsonbMapper.write(metadata))
            .param("lastModified", source.lastModified())
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentNotFoundException(id);
        }
    }

    @Override
    public void updateStatus(UUID id, DocumentStatus status) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE documents
                SET status = :status, updated_at = NOW()
                WHERE id = :id
                """)
            .param("status", status.name())
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentNotFoundException(id);
        }
    }

    @Override
    public void updateStatus(UUID id, DocumentStatus status, int chunkCount) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE documents
                SET status = :status, chunk_count = :chunkCount, updated_at = NOW()
                WHERE id = :id
                """)
            .param("status", status.name())
            .param("chunkCount", chunkCount)
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentNotFoundException(id);
        }
    }

    @Override
    public boolean deleteByHash(String contentHash) {
        return jdbcClient.sql("DELETE FROM documents WHERE content_hash = :hash")
            .param("hash", contentHash)
            .update() > 0;
    }

    @Override
    public IngestionStats getStats() {
        Map<DocumentStatus, Long> byStatus = new EnumMap<>(DocumentStatus.class);
        jdbcClient.sql("SELECT status, COUNT(*) AS total FROM documents GROUP BY status")
            .query((rs, rowNum) -> Map.entry(DocumentStatus.valueOf(rs.getString("status")), rs.getLong("total")))
            .list()
            .forEach(entry -> byStatus.put(entry.getKey(), entry.getValue()));

        Map<ContentType, Long> byContentType = new EnumMap<>(ContentType.class);
        jdbcClient.sql("SELECT content_type, COUNT(*) AS total FROM documents GROUP BY content_type")
            .query((rs, rowNum) -> Map.entry(ContentType.valueOf(rs.getString("content_type")), rs.getLong("total")))
            .list()
            .forEach(entry -> byContentType.put(entry.getKey(), entry.getValue()));

        Long totalChunks = jdbcClient.sql("SELECT COUNT(*) FROM document_chunks")
            .query(Long.class)
            .single();

        return new IngestionStats(byStatus, byContentType, totalChunks);
    }
}

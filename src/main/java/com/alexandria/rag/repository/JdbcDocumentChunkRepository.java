package com.alexandria.rag.repository;

import com.alexandria.rag.model.ChunkRecord;
import com.alexandria.rag.model.ContentType;
import com.alexandria.rag.model.DistanceMetric;
import com.alexandria.rag.model.DocumentMatch;
import com.alexandria.rag.model.SimilarityFilter;
import com.alexandria.rag.model.TextChunk;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcDocumentChunkRepository implements DocumentChunkRepository {

    private static final String MATCH_COLUMNS = """
        c.id, c.document_id, c.chunk_index, c.content, c.metadata, c.created_at,
        d.filename, d.filepath, d.content_type
        """;

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;
    private final JsonbMapper jsonbMapper;

    private RowMapper<DocumentMatch> matchMapper(boolean ranked) {
        return (rs, rowNum) -> new DocumentMatch(
            rs.getObject("id", UUID.class),
            rs.getObject("document_id", UUID.class),
            rs.getInt("chunk_index"),
            rs.getString("content"),
            ranked ? DistanceMetric.toSimilarity(rs.getDouble("distance")) : 0.0,
            rs.getString("filename"),
            rs.getString("filepath"),
            ContentType.valueOf(rs.getString("content_type")),
            jsonbMapper.read(rs.getString("metadata")),
            rs.getObject("created_at", OffsetDateTime.class)
        );
    }

    @Override
    public void replaceChunks(UUID documentId, List<ChunkRecord> records) {
        int deleted = jdbcClient.sql("DELETE FROM document_chunks WHERE document_id = :docId")
            .param("docId", documentId)
            .update();
        if (deleted > 0) {
            log.debug("Doc {}: removed {} previous chunks", documentId, deleted);
        }

        if (records == null || records.isEmpty()) {
            return;
        }

        String sql = """
                INSERT INTO document_chunks
                (document_id, chunk_index, content, content_hash, char_count, token_count, embedding, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb))
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                ChunkRecord record = records.get(i);
                TextChunk chunk = record.chunk();
                ps.setObject(1, documentId);
                ps.setInt(2, chunk.index());
                ps.setString(3, chunk.content());
                ps.setString(4, chunk.contentHash());
                ps.setInt(5, chunk.charCount());
                ps.setInt(6, chunk.tokenCount());
                ps.setObject(7, new PGvector(record.embedding()));
                ps.setString(8, jsonbMapper.write(chunk.metadata()));
            }

            @Override
            public int getBatchSize() {
                return records.size();
            }
        });
    }

    @Override
    public int countByDocumentId(UUID documentId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM document_chunks WHERE document_id = :docId")
            .param("docId", documentId)
            .query(Integer.class)
            .single();
    }

    @Override
    public List<DocumentMatch> findSimilar(float[] vector, DistanceMetric metric, SimilarityFilter filter, int limit) {
        StringBuilder sql = new StringBuilder("SELECT ")
            .append(MATCH_COLUMNS)
            .append(", c.embedding ").append(metric.operator()).append(" :vector AS distance\n")
            .append("""
                FROM document_chunks c
                JOIN documents d ON c.document_id = d.id
                WHERE c.embedding IS NOT NULL
                """);

        if (!filter.documentIds().isEmpty()) {
            sql.append(" AND c.document_id IN (:documentIds)");
        }
        if (!filter.contentTypes().isEmpty()) {
            sql.append(" AND d.content_type IN (:contentTypes)");
        }
        // date windows select documents by when they were first ingested
        filter.createdFrom().ifPresent(from -> sql.append(" AND d.created_at >= :createdFrom"));
        filter.createdTo().ifPresent(to -> sql.append(" AND d.created_at <= :createdTo"));
        filter.excludeChunkId().ifPresent(id -> sql.append(" AND c.id <> :excludeId"));
        sql.append("\nORDER BY distance ASC\nLIMIT :limit");

        var statement = jdbcClient.sql(sql.toString())
            .param("vector", new PGvector(vector))
            .param("limit", limit);

        if (!filter.documentIds().isEmpty()) {
            statement.param("documentIds", filter.documentIds());
        }
        if (!filter.contentTypes().isEmpty()) {
            statement.param("contentTypes", filter.contentTypes().stream().map(ContentType::name).toList());
        }
        filter.createdFrom().ifPresent(from -> statement.param("createdFrom", from));
        filter.createdTo().ifPresent(to -> statement.param("createdTo", to));
        filter.excludeChunkId().ifPresent(id -> statement.param("excludeId", id));

        return statement.query(matchMapper(true)).list();
    }

    @Override
    public List<DocumentMatch> findByDocumentId(UUID documentId, int limit) {
        String sql = "SELECT " + MATCH_COLUMNS + """
            FROM document_chunks c
            JOIN documents d ON c.document_id = d.id
            WHERE c.document_id = :docId
            ORDER BY c.chunk_index ASC
            LIMIT :limit
            """;

        return jdbcClient.sql(sql)
            .param("docId", documentId)
            .param("limit", limit)
            .query(matchMapper(false))
            .list();
    }

    @Override
    public List<DocumentMatch> findRange(UUID documentId, int fromIndex, int toIndex) {
        String sql = "SELECT " + MATCH_COLUMNS + """
            FROM document_chunks c
            JOIN documents d ON c.document_id = d.id
            WHERE c.document_id = :docId
              AND c.chunk_index BETWEEN :fromIndex AND :toIndex
            ORDER BY c.chunk_index ASC
            """;

        return jdbcClient.sql(sql)
            .param("docId", documentId)
            .param("fromIndex", fromIndex)
            .param("toIndex", toIndex)
            .query(matchMapper(false))
            .list();
    }

    @Override
    public Optional<float[]> findEmbedding(UUID chunkId) {
        return jdbcClient.sql("SELECT embedding::text AS embedding FROM document_chunks WHERE id = :id AND embedding IS NOT NULL")
            .param("id", chunkId)
            .query((rs, rowNum) -> new PGvector(rs.getString("embedding")).toArray())
            .optional();
    }
}

package com.alexandria.rag.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Optional restrictions applied inside the vector query. Empty collections mean "no filter".
 */
public record SimilarityFilter(
    List<UUID> documentIds,
    List<ContentType> contentTypes,
    Optional<OffsetDateTime> createdFrom,
    Optional<OffsetDateTime> createdTo,
    Optional<UUID> excludeChunkId
) {

    public static SimilarityFilter none() {
        return new SimilarityFilter(List.of(), List.of(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static SimilarityFilter from(SearchQuery query) {
        return new SimilarityFilter(
            query.documentIds(),
            query.contentTypes(),
            query.dateRange().map(DateRange::from),
            query.dateRange().map(DateRange::to),
            Optional.empty()
        );
    }

    public SimilarityFilter excluding(UUID chunkId) {
        return new SimilarityFilter(documentIds, contentTypes, createdFrom, createdTo, Optional.of(chunkId));
    }
}

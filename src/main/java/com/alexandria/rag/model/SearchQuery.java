package com.alexandria.rag.model;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

public record SearchQuery(
    String queryText,
    int maxResults,
    List<UUID> documentIds,
    List<ContentType> contentTypes,
    Optional<DateRange> dateRange,
    DistanceMetric distanceMetric,
    OptionalDouble minSimilarity
) {

    public SearchQuery {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        }
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
        contentTypes = contentTypes == null ? List.of() : List.copyOf(contentTypes);
        dateRange = dateRange == null ? Optional.empty() : dateRange;
        distanceMetric = distanceMetric == null ? DistanceMetric.L2 : distanceMetric;
        minSimilarity = minSimilarity == null ? OptionalDouble.empty() : minSimilarity;
    }

    public static SearchQuery of(String queryText, int maxResults) {
        return new SearchQuery(queryText, maxResults, List.of(), List.of(), Optional.empty(),
            DistanceMetric.L2, OptionalDouble.empty());
    }

    public SearchQuery withDocumentIds(List<UUID> ids) {
        return new SearchQuery(queryText, maxResults, ids, contentTypes, dateRange, distanceMetric, minSimilarity);
    }

    public SearchQuery withContentTypes(List<ContentType> types) {
        return new SearchQuery(queryText, maxResults, documentIds, types, dateRange, distanceMetric, minSimilarity);
    }

    public SearchQuery withDateRange(DateRange range) {
        return new SearchQuery(queryText, maxResults, documentIds, contentTypes, Optional.of(range), distanceMetric, minSimilarity);
    }

    public SearchQuery withDistanceMetric(DistanceMetric metric) {
        return new SearchQuery(queryText, maxResults, documentIds, contentTypes, dateRange, metric, minSimilarity);
    }

    public SearchQuery withMinSimilarity(double threshold) {
        return new SearchQuery(queryText, maxResults, documentIds, contentTypes, dateRange, distanceMetric,
            OptionalDouble.of(threshold));
    }
}

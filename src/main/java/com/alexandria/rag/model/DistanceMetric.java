package com.alexandria.rag.model;

/**
 * Vector distance used for ranking. Each metric maps to its pgvector operator.
 */
public enum DistanceMetric {
    L2("<->"),
    COSINE("<=>");

    private final String operator;

    DistanceMetric(String operator) {
        this.operator = operator;
    }

    public String operator() {
        return operator;
    }

    /**
     * Monotonic transform of a distance into a relevance score in (0, 1].
     *
     * @throws IllegalArgumentException if the distance is NaN
     */
    public static double toSimilarity(double distance) {
        if (Double.isNaN(distance)) {
            throw new IllegalArgumentException("Distance is not a number");
        }
        return 1.0 / (1.0 + Math.max(0.0, distance));
    }

    public static DistanceMetric fromValue(String value) {
        if ("l2".equalsIgnoreCase(value) || "euclidean".equalsIgnoreCase(value)) {
            return L2;
        }
        if ("cosine".equalsIgnoreCase(value)) {
            return COSINE;
        }
        throw new IllegalArgumentException("Invalid distance method: " + value);
    }
}

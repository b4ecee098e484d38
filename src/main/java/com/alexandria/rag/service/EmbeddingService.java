package com.alexandria.rag.service;

import java.util.List;

public interface EmbeddingService {

    float[] embed(String text);

    /**
     * One vector per input, in input order.
     */
    List<float[]> embedAll(List<String> texts);

    float[] embedQuery(String query);
}

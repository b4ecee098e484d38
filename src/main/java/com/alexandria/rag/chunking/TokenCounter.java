package com.alexandria.rag.chunking;

/**
 * Exact token count of a text under the embedding model's tokenizer.
 */
@FunctionalInterface
public interface TokenCounter {

    int count(String text);
}

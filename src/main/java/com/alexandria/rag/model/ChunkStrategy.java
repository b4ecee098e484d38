package com.alexandria.rag.model;

public enum ChunkStrategy {
    FIXED_SIZE("fixed_size"),
    SENTENCE_BASED("sentence_based"),
    PARAGRAPH_BASED("paragraph_based"),
    CODE_BASED("code_based"),
    MARKDOWN_BASED("markdown_based");

    private final String value;

    ChunkStrategy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ChunkStrategy fromValue(String value) {
        for (ChunkStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value) || strategy.name().equalsIgnoreCase(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown chunk strategy: " + value);
    }
}

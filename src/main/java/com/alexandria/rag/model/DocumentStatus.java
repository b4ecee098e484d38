package com.alexandria.rag.model;

public enum DocumentStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED
}

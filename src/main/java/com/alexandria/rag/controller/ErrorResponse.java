package com.alexandria.rag.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}

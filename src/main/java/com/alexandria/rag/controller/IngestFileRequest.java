package com.alexandria.rag.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

public record IngestFileRequest(
    @NotBlank String path,
    @Valid IngestOptionsRequest options
) {}

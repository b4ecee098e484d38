package com.alexandria.rag.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

public record IngestDirectoryRequest(
    @NotBlank String path,
    Boolean recursive,
    @Valid IngestOptionsRequest options
) {}

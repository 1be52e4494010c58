package com.marketpulse.rag.controller;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record AddDocumentsRequest(
    @NotEmpty List<DocumentRequest> documents,
    String source
) {}

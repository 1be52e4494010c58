package com.marketpulse.rag.controller;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record RetrieveRequest(
    @NotBlank String query,
    @Min(1) @Max(100) Integer k,
    Map<String, String> filter
) {}

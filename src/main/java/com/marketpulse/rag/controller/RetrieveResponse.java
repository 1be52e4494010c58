package com.marketpulse.rag.controller;

import com.marketpulse.rag.model.RetrievalResult;

import java.util.List;

public record RetrieveResponse(
    String query,
    List<RetrievalResult> results
) {}

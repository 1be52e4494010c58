package com.marketpulse.rag.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}

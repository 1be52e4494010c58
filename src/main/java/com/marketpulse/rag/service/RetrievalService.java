package com.marketpulse.rag.service;

import com.marketpulse.rag.controller.DocumentRequest;
import com.marketpulse.rag.model.AddDocumentsResult;
import com.marketpulse.rag.model.HealthStatus;
import com.marketpulse.rag.model.IndexStats;
import com.marketpulse.rag.model.RetrievalResult;

import java.util.List;
import java.util.Map;

public interface RetrievalService {
    AddDocumentsResult addDocuments(List<DocumentRequest> documents, String defaultSource);
    List<RetrievalResult> retrieve(String query, int k, Map<String, String> filter);
    HealthStatus healthCheck();
    int documentCount();
    IndexStats stats();
    boolean persistPendingChanges();
}

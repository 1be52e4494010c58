package com.marketpulse.rag.controller;

import com.marketpulse.rag.config.RetrievalProperties;
import com.marketpulse.rag.model.HealthStatus;
import com.marketpulse.rag.model.IndexStats;
import com.marketpulse.rag.service.RetrievalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class RetrievalController {

    private final RetrievalService retrievalService;
    private final RetrievalProperties properties;

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        HealthStatus health = retrievalService.healthCheck();
        HttpStatus status = health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }

    @PostMapping("/retrieve")
    public ResponseEntity<RetrieveResponse> retrieve(@Valid @RequestBody RetrieveRequest request) {
        int k = request.k() != null ? request.k() : properties.defaultK();
        var results = retrievalService.retrieve(request.query(), k, request.filter());
        return ResponseEntity.ok(new RetrieveResponse(request.query(), results));
    }

    @PostMapping("/add_documents")
    public ResponseEntity<AddDocumentsResponse> addDocuments(@Valid @RequestBody AddDocumentsRequest request) {
        var result = retrievalService.addDocuments(request.documents(), request.source());
        return ResponseEntity.ok(AddDocumentsResponse.from(result));
    }

    @GetMapping("/documents/count")
    public ResponseEntity<CountResponse> documentCount() {
        return ResponseEntity.ok(new CountResponse(retrievalService.documentCount()));
    }

    @GetMapping("/stats")
    public ResponseEntity<IndexStats> stats() {
        return ResponseEntity.ok(retrievalService.stats());
    }
}

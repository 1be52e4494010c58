package com.marketpulse.rag.worker;

import com.marketpulse.rag.service.RetrievalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-attempts the index snapshot save after a batch whose save failed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SnapshotRetryWorker {

    private final RetrievalService retrievalService;

    @Scheduled(fixedDelayString = "${app.rag.persistence.retry-interval-ms:30000}")
    public void retryPendingSnapshot() {
        log.debug("Checking for unsaved index changes...");
        if (retrievalService.persistPendingChanges()) {
            log.info("Recovered pending index snapshot");
        }
    }
}

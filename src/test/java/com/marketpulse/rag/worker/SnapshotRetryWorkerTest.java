package com.marketpulse.rag.worker;

import com.marketpulse.rag.service.RetrievalService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SnapshotRetryWorkerTest {

    @Mock
    private RetrievalService retrievalService;

    @InjectMocks
    private SnapshotRetryWorker worker;

    @Test
    @DisplayName("Should ask the service to persist pending changes on every tick")
    void shouldDelegateToService() {
        when(retrievalService.persistPendingChanges()).thenReturn(true, false);

        worker.retryPendingSnapshot();
        worker.retryPendingSnapshot();

        verify(retrievalService, times(2)).persistPendingChanges();
    }
}

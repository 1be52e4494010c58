package com.marketpulse.rag.service;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.marketpulse.rag.controller.DocumentRequest;
import com.marketpulse.rag.exception.EmbeddingException;
import com.marketpulse.rag.exception.PersistenceException;
import com.marketpulse.rag.exception.ServiceNotReadyException;
import com.marketpulse.rag.exception.ValidationException;
import com.marketpulse.rag.index.DocumentStore;
import com.marketpulse.rag.index.ScoredPosition;
import com.marketpulse.rag.index.VectorIndex;
import com.marketpulse.rag.model.AddDocumentsResult;
import com.marketpulse.rag.model.Document;
import com.marketpulse.rag.model.HealthStatus;
import com.marketpulse.rag.model.IndexStats;
import com.marketpulse.rag.model.RetrievalResult;
import com.marketpulse.rag.model.ServiceState;
import com.marketpulse.rag.repository.IndexSnapshot;
import com.marketpulse.rag.repository.SnapshotRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the vector index and the document store and keeps them position-aligned.
 *
 * <p>A read/write lock guards both collections: ingestion batches and snapshot
 * writes hold the write lock, queries and reports hold the read lock.
 * Embeddings are resolved outside the lock.</p>
 */
@Slf4j
@Service
public class RetrievalServiceImpl implements RetrievalService {

    private final EmbeddingService embeddingService;
    private final EmbeddingCache embeddingCache;
    private final SnapshotRepository snapshotRepository;
    private final int dimension;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile ServiceState state = ServiceState.UNINITIALIZED;
    private volatile String lastPersistenceError;
    private volatile OffsetDateTime lastUpdated;

    // guarded by lock
    private VectorIndex vectorIndex;
    private DocumentStore documentStore;
    private boolean unsavedChanges;

    private record PendingDocument(float[] vector, Document document) {}

    public RetrievalServiceImpl(
        EmbeddingService embeddingService,
        EmbeddingCache embeddingCache,
        SnapshotRepository snapshotRepository
    ) {
        this.embeddingService = embeddingService;
        this.embeddingCache = embeddingCache;
        this.snapshotRepository = snapshotRepository;
        this.dimension = embeddingService.dimension();
    }

    @PostConstruct
    public void initialize() {
        lock.writeLock().lock();
        try {
            if (state == ServiceState.READY) {
                log.warn("Retrieval service already initialized, ignoring");
                return;
            }

            Optional<IndexSnapshot> snapshot = Optional.empty();
            try {
                snapshot = snapshotRepository.load().filter(this::matchesDimension);
                snapshot.ifPresent(s -> {
                    vectorIndex = VectorIndex.of(dimension, s.vectors());
                    documentStore = DocumentStore.of(s.documents());
                });
            } catch (RuntimeException e) {
                log.error("Index snapshot could not be restored, starting empty", e);
                snapshot = Optional.empty();
            }

            if (snapshot.isPresent()) {
                log.info("Restored index with {} documents", documentStore.count());
            } else {
                vectorIndex = new VectorIndex(dimension);
                documentStore = new DocumentStore();
                log.info("Created new empty index with dimension {}", dimension);
            }
            state = ServiceState.READY;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public AddDocumentsResult addDocuments(List<DocumentRequest> documents, String defaultSource) {
        ensureReady();
        if (documents == null || documents.isEmpty()) {
            throw new ValidationException("No documents provided");
        }

        String batchSource = defaultSource == null || defaultSource.isBlank() ? Document.UNKNOWN_SOURCE : defaultSource;
        log.info("Adding {} documents from source '{}'", documents.size(), batchSource);

        List<PendingDocument> pending = new ArrayList<>(documents.size());
        int skipped = 0;
        int failed = 0;
        EmbeddingException lastFailure = null;

        for (DocumentRequest request : documents) {
            if (request == null || request.content() == null || request.content().isBlank()) {
                skipped++;
                continue;
            }
            Document document = toDocument(request, batchSource);
            try {
                pending.add(new PendingDocument(embeddingCache.getOrCompute(document.content()), document));
            } catch (EmbeddingException e) {
                failed++;
                lastFailure = e;
                log.warn("Skipping document, embedding failed: {}", e.getMessage());
            }
        }

        if (pending.isEmpty() && lastFailure != null) {
            throw lastFailure;
        }
        for (PendingDocument p : pending) {
            if (p.vector().length != dimension) {
                throw new EmbeddingException(String.format(
                    "Embedding of dimension %d cannot be stored in an index of dimension %d", p.vector().length, dimension));
            }
        }

        int total;
        lock.writeLock().lock();
        try {
            for (PendingDocument p : pending) {
                appendPair(p.vector(), p.document());
            }
            if (!pending.isEmpty()) {
                unsavedChanges = true;
                lastUpdated = OffsetDateTime.now();
                saveSnapshot();
            }
            total = documentStore.count();
        } finally {
            lock.writeLock().unlock();
        }

        if (pending.isEmpty()) {
            log.warn("No valid documents to add");
        } else {
            log.info("Added {} documents ({} skipped, {} failed), index now holds {}",
                pending.size(), skipped, failed, total);
        }
        return new AddDocumentsResult(pending.size(), skipped, failed, batchSource, total);
    }

    @Override
    public List<RetrievalResult> retrieve(String query, int k, Map<String, String> filter) {
        ensureReady();
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query cannot be empty");
        }
        if (k < 1) {
            throw new ValidationException("k must be at least 1");
        }

        if (indexSize() == 0) {
            log.debug("Index is empty, nothing to retrieve for '{}'", query);
            return Collections.emptyList();
        }

        float[] queryVector = embeddingCache.getOrCompute(query);

        List<RetrievalResult> results = new ArrayList<>();
        lock.readLock().lock();
        try {
            List<ScoredPosition> hits = vectorIndex.search(queryVector, k);
            for (int i = 0; i < hits.size(); i++) {
                ScoredPosition hit = hits.get(i);
                Document document = documentStore.get(hit.position());
                if (matchesFilter(document, filter)) {
                    results.add(RetrievalResult.from(document, hit.score(), i + 1));
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        log.debug("Retrieved {} of top {} documents for '{}'", results.size(), k, query);
        return results;
    }

    @Override
    public HealthStatus healthCheck() {
        try {
            if (state != ServiceState.READY) {
                return new HealthStatus(HealthStatus.INITIALIZING, 0, 0,
                    embeddingService.isReady(), dimension, true, lastPersistenceError);
            }

            int documentCount;
            int indexSize;
            lock.readLock().lock();
            try {
                documentCount = documentStore.count();
                indexSize = vectorIndex.size();
            } finally {
                lock.readLock().unlock();
            }

            boolean consistent = documentCount == indexSize;
            if (!consistent) {
                log.error("Index inconsistency: {} documents but {} vectors", documentCount, indexSize);
            }
            return new HealthStatus(
                consistent ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY,
                documentCount,
                indexSize,
                embeddingService.isReady(),
                dimension,
                consistent,
                lastPersistenceError
            );
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return new HealthStatus(HealthStatus.UNHEALTHY, 0, 0, false, dimension, false, lastPersistenceError);
        }
    }

    @Override
    public int documentCount() {
        ensureReady();
        lock.readLock().lock();
        try {
            return documentStore.count();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public IndexStats stats() {
        ensureReady();
        int documentCount;
        int indexSize;
        lock.readLock().lock();
        try {
            documentCount = documentStore.count();
            indexSize = vectorIndex.size();
        } finally {
            lock.readLock().unlock();
        }

        CacheStats cacheStats = embeddingCache.stats();
        return new IndexStats(
            indexSize,
            documentCount,
            embeddingService.modelName(),
            dimension,
            embeddingCache.size(),
            cacheStats.hitCount(),
            cacheStats.missCount(),
            lastUpdated
        );
    }

    /**
     * Saves the snapshot again if the last save after a batch failed.
     *
     * @return true when a snapshot was written
     */
    @Override
    public boolean persistPendingChanges() {
        if (state != ServiceState.READY) {
            return false;
        }
        lock.writeLock().lock();
        try {
            if (!unsavedChanges) {
                return false;
            }
            log.info("Retrying snapshot save for {} documents", documentStore.count());
            saveSnapshot();
            return !unsavedChanges;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // The only way either collection grows. Caller holds the write lock.
    private void appendPair(float[] vector, Document document) {
        int position = vectorIndex.size();
        if (documentStore.count() != position) {
            throw new IllegalStateException(String.format(
                "Index holds %d vectors but store holds %d documents", position, documentStore.count()));
        }
        vectorIndex.append(vector);
        documentStore.append(document.withPosition(position));
    }

    // Caller holds the write lock.
    private void saveSnapshot() {
        try {
            snapshotRepository.save(new IndexSnapshot(dimension, vectorIndex.vectors(), documentStore.documents()));
            unsavedChanges = false;
            lastPersistenceError = null;
        } catch (PersistenceException e) {
            lastPersistenceError = e.getMessage();
            log.error("Failed to persist index snapshot, keeping in-memory state", e);
        }
    }

    private int indexSize() {
        lock.readLock().lock();
        try {
            return vectorIndex.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean matchesDimension(IndexSnapshot snapshot) {
        if (snapshot.dimension() != dimension) {
            log.warn("Discarding index snapshot of dimension {}, the embedding model produces {}",
                snapshot.dimension(), dimension);
            return false;
        }
        return true;
    }

    private void ensureReady() {
        if (state != ServiceState.READY) {
            throw new ServiceNotReadyException();
        }
    }

    private static boolean matchesFilter(Document document, Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        return filter.entrySet().stream()
            .allMatch(e -> document.field(e.getKey())
                .map(value -> value.equals(e.getValue()))
                .orElse(false));
    }

    private static Document toDocument(DocumentRequest request, String batchSource) {
        String source = request.source() == null || request.source().isBlank() ? batchSource : request.source();
        return new Document(
            request.content(),
            request.module(),
            request.subModule(),
            request.issueType(),
            request.subIssueType(),
            source,
            -1
        );
    }
}

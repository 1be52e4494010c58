package com.marketpulse.rag.service;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.marketpulse.rag.exception.EmbeddingException;
import com.marketpulse.rag.index.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Memoizes normalized embeddings by the MD5 of the exact text.
 *
 * <p>The in-memory tier is a size-bounded Caffeine cache of futures; concurrent
 * misses on the same text compute once, on the thread that missed first and
 * outside the cache's own locks. When a directory is configured every computed
 * vector is also written to {@code <directory>/<model>-<dimension>/<md5>.vec}
 * and read back on later misses, so vectors survive restarts and evictions but
 * are never shared between embedding models.</p>
 */
@Slf4j
public class EmbeddingCache {

    private static final String ENTRY_SUFFIX = ".vec";

    private final EmbeddingService embeddingService;
    private final AsyncCache<String, float[]> entries;
    private final Path directory;
    private final int dimension;

    public EmbeddingCache(EmbeddingService embeddingService, long maxEntries, Path directory) {
        this.embeddingService = embeddingService;
        this.entries = Caffeine.newBuilder()
            .maximumSize(maxEntries)
            .recordStats()
            .buildAsync();
        if (directory == null) {
            this.directory = null;
            this.dimension = 0;
            return;
        }
        this.dimension = embeddingService.dimension();
        this.directory = directory.resolve(modelDirectory(embeddingService.modelName(), dimension));
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create embedding cache directory " + this.directory, e);
        }
    }

    public static String keyFor(String text) {
        return DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8));
    }

    static String modelDirectory(String modelName, int dimension) {
        String model = modelName == null || modelName.isBlank() ? "unknown" : modelName.trim();
        return model.replaceAll("[^a-zA-Z0-9._-]", "_") + "-" + dimension;
    }

    /**
     * Returns the normalized embedding of {@code text}, calling the embedding
     * service only when no entry exists. A failed computation stores nothing.
     */
    public float[] getOrCompute(String text) {
        String key = keyFor(text);
        CompletableFuture<float[]> pending = new CompletableFuture<>();
        CompletableFuture<float[]> future = entries.get(key, (k, executor) -> pending);

        if (future == pending) {
            try {
                pending.complete(loadOrCompute(key, text));
            } catch (RuntimeException | Error e) {
                // completing exceptionally drops the entry
                pending.completeExceptionally(e);
                throw e;
            }
        }
        return await(future).clone();
    }

    public long size() {
        return entries.synchronous().estimatedSize();
    }

    public CacheStats stats() {
        return entries.synchronous().stats();
    }

    private static float[] await(CompletableFuture<float[]> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new EmbeddingException("Error during text vectorization", e.getCause());
        }
    }

    private float[] loadOrCompute(String key, String text) {
        float[] stored = readEntry(key);
        if (stored != null) {
            log.debug("Embedding cache disk hit for {}", key);
            return stored;
        }

        log.debug("Embedding cache miss for {}", key);
        float[] vector = VectorMath.normalize(embeddingService.embed(text));
        writeEntry(key, vector);
        return vector;
    }

    private float[] readEntry(String key) {
        if (directory == null) {
            return null;
        }
        Path file = directory.resolve(key + ENTRY_SUFFIX);
        if (!Files.exists(file)) {
            return null;
        }
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(file));
             DataInputStream in = new DataInputStream(raw)) {
            int length = in.readInt();
            if (length != dimension) {
                log.warn("Ignoring cached embedding {} with dimension {}", key, length);
                return null;
            }
            float[] vector = new float[length];
            for (int i = 0; i < length; i++) {
                vector[i] = in.readFloat();
            }
            return vector;
        } catch (IOException e) {
            log.warn("Failed to read cached embedding {}: {}", key, e.getMessage());
            return null;
        }
    }

    private void writeEntry(String key, float[] vector) {
        if (directory == null) {
            return;
        }
        Path target = directory.resolve(key + ENTRY_SUFFIX);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, key, ".tmp");
            try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(temp)))) {
                out.writeInt(vector.length);
                for (float v : vector) {
                    out.writeFloat(v);
                }
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.warn("Failed to cache embedding {}: {}", key, e.getMessage());
        } finally {
            deleteQuietly(temp);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temporary cache file {}: {}", temp, e.getMessage());
        }
    }
}

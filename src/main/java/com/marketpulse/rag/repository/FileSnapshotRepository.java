package com.marketpulse.rag.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpulse.rag.exception.PersistenceException;
import com.marketpulse.rag.model.Document;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stores a snapshot as two files in one directory: a binary vector file and a
 * JSON document list. Each file is written to a temporary sibling and moved
 * into place, so readers only ever see complete files. The vector file is
 * always replaced first; a load that finds more vectors than documents keeps
 * the prefix matching the documents, which is the previous complete snapshot.
 */
@Slf4j
public class FileSnapshotRepository implements SnapshotRepository {

    public static final String VECTORS_FILE = "vectors.idx";
    public static final String DOCUMENTS_FILE = "documents.json";

    static final int MAGIC = 0x4D505649;
    static final int FORMAT_VERSION = 1;

    private static final TypeReference<List<Document>> DOCUMENT_LIST = new TypeReference<>() {};

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSnapshotRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(IndexSnapshot snapshot) {
        try {
            Files.createDirectories(directory);
            writeAtomically(directory.resolve(VECTORS_FILE), out -> writeVectors(out, snapshot));
            writeAtomically(directory.resolve(DOCUMENTS_FILE), out -> objectMapper.writeValue(out, snapshot.documents()));
        } catch (IOException e) {
            throw new PersistenceException(directory, e);
        }
        log.info("Saved index snapshot with {} documents to {}", snapshot.size(), directory);
    }

    @Override
    public Optional<IndexSnapshot> load() {
        Path vectorsFile = directory.resolve(VECTORS_FILE);
        Path documentsFile = directory.resolve(DOCUMENTS_FILE);

        if (!Files.exists(vectorsFile) || !Files.exists(documentsFile)) {
            log.info("No index snapshot found in {}", directory);
            return Optional.empty();
        }

        try {
            VectorBlock block;
            try (InputStream in = new BufferedInputStream(Files.newInputStream(vectorsFile))) {
                block = readVectors(in);
            }
            List<Document> documents;
            try (InputStream in = new BufferedInputStream(Files.newInputStream(documentsFile))) {
                documents = objectMapper.readValue(in, DOCUMENT_LIST);
            }

            List<float[]> vectors = block.vectors();
            if (documents == null || documents.size() > vectors.size()) {
                log.error("Snapshot in {} is inconsistent: {} vectors, {} documents",
                    directory, vectors.size(), documents == null ? 0 : documents.size());
                return Optional.empty();
            }
            if (vectors.size() > documents.size()) {
                // vectors are moved into place first; extra rows belong to a batch whose save was cut short
                log.warn("Snapshot in {} has {} vectors but {} documents, dropping the unmatched tail",
                    directory, vectors.size(), documents.size());
                vectors = vectors.subList(0, documents.size());
            }
            for (int i = 0; i < documents.size(); i++) {
                if (documents.get(i).position() != i) {
                    log.error("Snapshot in {} has document at index {} with position {}",
                        directory, i, documents.get(i).position());
                    return Optional.empty();
                }
            }

            log.info("Loaded index snapshot with {} documents from {}", documents.size(), directory);
            return Optional.of(new IndexSnapshot(block.dimension(), vectors, documents));
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load index snapshot from {}", directory, e);
            return Optional.empty();
        }
    }

    private void writeVectors(OutputStream target, IndexSnapshot snapshot) throws IOException {
        DataOutputStream out = new DataOutputStream(target);
        out.writeInt(MAGIC);
        out.writeInt(FORMAT_VERSION);
        out.writeInt(snapshot.dimension());
        out.writeInt(snapshot.vectors().size());
        for (float[] vector : snapshot.vectors()) {
            if (vector.length != snapshot.dimension()) {
                throw new IOException("Vector of dimension " + vector.length + " in snapshot of dimension " + snapshot.dimension());
            }
            for (float v : vector) {
                out.writeFloat(v);
            }
        }
        out.flush();
    }

    private VectorBlock readVectors(InputStream source) throws IOException {
        DataInputStream in = new DataInputStream(source);
        if (in.readInt() != MAGIC) {
            throw new IOException("Not a vector index file");
        }
        int version = in.readInt();
        if (version != FORMAT_VERSION) {
            throw new IOException("Unsupported vector index format version " + version);
        }
        int dimension = in.readInt();
        int count = in.readInt();
        if (dimension <= 0 || count < 0) {
            throw new IOException("Corrupt vector index header: dimension=" + dimension + ", count=" + count);
        }

        List<float[]> vectors = new ArrayList<>(count);
        for (int row = 0; row < count; row++) {
            float[] vector = new float[dimension];
            for (int i = 0; i < dimension; i++) {
                vector[i] = in.readFloat();
            }
            vectors.add(vector);
        }
        if (in.read() != -1) {
            throw new IOException("Trailing bytes after " + count + " vectors");
        }
        return new VectorBlock(dimension, vectors);
    }

    private void writeAtomically(Path target, StreamWriter writer) throws IOException {
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
                writer.write(out);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @FunctionalInterface
    private interface StreamWriter {
        void write(OutputStream out) throws IOException;
    }

    private record VectorBlock(int dimension, List<float[]> vectors) {}
}

package com.marketpulse.rag.index;

import com.marketpulse.rag.model.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Documents in insertion order. A document's position is its list index.
 *
 * <p>Not thread-safe; the owning service serializes access.</p>
 */
public class DocumentStore {

    private final List<Document> documents = new ArrayList<>();

    public static DocumentStore of(List<Document> documents) {
        DocumentStore store = new DocumentStore();
        documents.forEach(store::append);
        return store;
    }

    public int append(Document document) {
        int position = documents.size();
        if (document.position() != position) {
            throw new IllegalArgumentException(String.format(
                "Document carries position %d but the next free position is %d", document.position(), position));
        }
        documents.add(document);
        return position;
    }

    public Document get(int position) {
        if (position < 0 || position >= documents.size()) {
            throw new IndexOutOfBoundsException("No document at position " + position);
        }
        return documents.get(position);
    }

    public int count() {
        return documents.size();
    }

    public List<Document> documents() {
        return List.copyOf(documents);
    }
}

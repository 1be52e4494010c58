package com.marketpulse.rag.index;

import com.marketpulse.rag.model.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentStoreTest {

    private static Document doc(String content, int position) {
        return new Document(content, "Camera", null, null, null, null, position);
    }

    @Test
    void shouldAppendAtNextPosition() {
        DocumentStore store = new DocumentStore();

        assertThat(store.append(doc("first", 0))).isZero();
        assertThat(store.append(doc("second", 1))).isEqualTo(1);

        assertThat(store.count()).isEqualTo(2);
        assertThat(store.get(1).content()).isEqualTo("second");
    }

    @Test
    void shouldRejectDocumentWithForeignPosition() {
        DocumentStore store = DocumentStore.of(List.of(doc("first", 0)));

        assertThatThrownBy(() -> store.append(doc("second", 5)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("next free position is 1");
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void shouldRejectUnknownPosition() {
        DocumentStore store = new DocumentStore();

        assertThatThrownBy(() -> store.get(0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> store.get(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void shouldExposeImmutableSnapshotOfDocuments() {
        DocumentStore store = DocumentStore.of(List.of(doc("first", 0)));
        List<Document> documents = store.documents();

        store.append(doc("second", 1));

        assertThat(documents).hasSize(1);
        assertThatThrownBy(() -> documents.add(doc("third", 2))).isInstanceOf(UnsupportedOperationException.class);
    }
}

package com.marketpulse.rag.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Flat inner-product index over normalized vectors, stored row-major in one
 * growable array. Rows are addressed by their insertion position.
 *
 * <p>Not thread-safe; the owning service serializes access.</p>
 */
public class VectorIndex {

    private static final int INITIAL_CAPACITY = 64;

    private final int dimension;
    private float[] data;
    private int size;

    public VectorIndex(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        this.data = new float[INITIAL_CAPACITY * dimension];
    }

    public static VectorIndex of(int dimension, List<float[]> vectors) {
        VectorIndex index = new VectorIndex(dimension);
        vectors.forEach(index::append);
        return index;
    }

    public int append(float[] vector) {
        checkDimension(vector);
        ensureCapacity(size + 1);
        System.arraycopy(vector, 0, data, size * dimension, dimension);
        return size++;
    }

    /**
     * Returns up to {@code k} positions with a positive score, best first.
     * Equal scores keep insertion order.
     */
    public List<ScoredPosition> search(float[] query, int k) {
        checkDimension(query);
        int limit = Math.min(k, size);
        if (limit <= 0) {
            return Collections.emptyList();
        }

        PriorityQueue<ScoredPosition> top = new PriorityQueue<>(limit, ScoredPosition.BEST_FIRST.reversed());
        for (int position = 0; position < size; position++) {
            double score = VectorMath.dot(data, position * dimension, query);
            if (score <= 0) {
                continue;
            }
            if (top.size() < limit) {
                top.add(new ScoredPosition(position, score));
            } else if (score > top.peek().score()) {
                top.poll();
                top.add(new ScoredPosition(position, score));
            }
        }

        List<ScoredPosition> results = new ArrayList<>(top);
        results.sort(ScoredPosition.BEST_FIRST);
        return results;
    }

    public float[] vector(int position) {
        if (position < 0 || position >= size) {
            throw new IndexOutOfBoundsException("No vector at position " + position);
        }
        int offset = position * dimension;
        return Arrays.copyOfRange(data, offset, offset + dimension);
    }

    public List<float[]> vectors() {
        List<float[]> copy = new ArrayList<>(size);
        for (int position = 0; position < size; position++) {
            copy.add(vector(position));
        }
        return copy;
    }

    public int size() {
        return size;
    }

    public int dimension() {
        return dimension;
    }

    private void checkDimension(float[] vector) {
        if (vector == null || vector.length != dimension) {
            throw new IllegalArgumentException(String.format(
                "Expected vector of dimension %d but got %s",
                dimension, vector == null ? "null" : vector.length));
        }
    }

    private void ensureCapacity(int rows) {
        if (rows * dimension > data.length) {
            int newRows = Math.max(rows, (data.length / dimension) * 2);
            data = Arrays.copyOf(data, newRows * dimension);
        }
    }
}

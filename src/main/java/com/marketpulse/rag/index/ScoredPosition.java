package com.marketpulse.rag.index;

import java.util.Comparator;

public record ScoredPosition(int position, double score) {

    /** Best first: higher score, then lower (earlier) position. */
    public static final Comparator<ScoredPosition> BEST_FIRST =
        Comparator.comparingDouble(ScoredPosition::score).reversed()
            .thenComparingInt(ScoredPosition::position);
}

package com.marketpulse.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RetrievalResult(
    @JsonProperty("id") int position,
    double score,
    int rank,
    String content,
    String module,
    @JsonProperty("sub_module") String subModule,
    @JsonProperty("issue_type") String issueType,
    @JsonProperty("sub_issue_type") String subIssueType,
    String source
) {
    public static RetrievalResult from(Document document, double score, int rank) {
        return new RetrievalResult(
            document.position(),
            score,
            rank,
            document.content(),
            document.module(),
            document.subModule(),
            document.issueType(),
            document.subIssueType(),
            document.source()
        );
    }
}

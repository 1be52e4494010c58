package com.marketpulse.rag.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One raw issue report as submitted for ingestion. Every field is optional on
 * the wire; items without content are skipped.
 */
public record DocumentRequest(
    String content,
    String module,
    @JsonProperty("sub_module") String subModule,
    @JsonProperty("issue_type") String issueType,
    @JsonProperty("sub_issue_type") String subIssueType,
    String source
) {
    public static DocumentRequest of(String content, String module) {
        return new DocumentRequest(content, module, null, null, null, null);
    }
}

package com.marketpulse.rag.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

public record Document(
    String content,
    String module,
    @JsonProperty("sub_module") String subModule,
    @JsonProperty("issue_type") String issueType,
    @JsonProperty("sub_issue_type") String subIssueType,
    String source,
    int position
) {
    public static final String UNKNOWN_SOURCE = "Unknown";

    public Document {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Document content must not be blank");
        }
        module = module == null ? "" : module;
        subModule = subModule == null ? "" : subModule;
        issueType = issueType == null ? "" : issueType;
        subIssueType = subIssueType == null ? "" : subIssueType;
        source = source == null || source.isBlank() ? UNKNOWN_SOURCE : source;
    }

    public Document withPosition(int newPosition) {
        return new Document(content, module, subModule, issueType, subIssueType, source, newPosition);
    }

    /**
     * Looks up a field by its external (snake_case) name. Unknown names yield empty.
     */
    @JsonIgnore
    public Optional<String> field(String name) {
        return switch (name) {
            case "content" -> Optional.of(content);
            case "module" -> Optional.of(module);
            case "sub_module" -> Optional.of(subModule);
            case "issue_type" -> Optional.of(issueType);
            case "sub_issue_type" -> Optional.of(subIssueType);
            case "source" -> Optional.of(source);
            default -> Optional.empty();
        };
    }
}

package com.marketpulse.rag.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Validated
@ConfigurationProperties(prefix = "app.rag")
public record RetrievalProperties(
	@NotNull @DefaultValue("./data/index") Path indexDir,
	@NotNull @Min(1) @Max(100) @DefaultValue("3") Integer defaultK,
	@Valid @DefaultValue Embedding embedding,
	@Valid @DefaultValue Cache cache
) {

	public record Embedding(
		@NotBlank @DefaultValue("local") String provider,
		@NotBlank @DefaultValue("all-minilm-l6-v2") String modelName,
		@NotNull @Min(1) @DefaultValue("384") Integer dimension,
		String apiKey,
		@NotNull @Min(1) @DefaultValue("8000") Integer maxInputChars,
		@NotNull @Min(1) @DefaultValue("1500") Integer requestsPerMinute,
		@NotNull @Min(1) @DefaultValue("1000000") Integer tokensPerMinute
	) {}

	/**
	 * @param maxEntries upper bound of the in-memory tier
	 * @param directory optional directory holding one file per cached vector
	 */
	public record Cache(
		@NotNull @Min(1) @DefaultValue("10000") Long maxEntries,
		Path directory
	) {}
}

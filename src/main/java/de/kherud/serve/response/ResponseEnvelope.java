package de.kherud.serve.response;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Externally visible unit of generated output, for whole responses and for each streamed token alike.
 */
public record ResponseEnvelope(
	@JsonProperty("generated_text") String generatedText,
	@JsonProperty("num_input_tokens") int numInputTokens,
	@JsonProperty("num_input_tokens_batch") int numInputTokensBatch,
	@JsonProperty("num_generated_tokens") int numGeneratedTokens,
	@JsonProperty("preprocessing_time") double preprocessingTime
) {
}

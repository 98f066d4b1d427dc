package de.kherud.serve.error;

/**
 * Request-shape failures detected before any backend call. All of them map to a 400 response.
 */
public enum ErrorKind {
	INVALID_JSON("Invalid JSON format from http request."),
	EMPTY_PROMPT("Empty prompt is not supported."),
	INVALID_PROMPT_FORMAT("Invalid prompt format from the request."),
	STREAMING_WITH_MULTIPLE_PROMPTS_UNSUPPORTED("Streaming response is not supported when multiple prompts are provided."),
	MULTIPLE_PROMPTS_UNSUPPORTED("Multiple prompts are not supported when using openai compatible api.");

	private final String message;

	ErrorKind(String message) {
		this.message = message;
	}

	public String getMessage() {
		return message;
	}
}

package de.kherud.serve.batch;

/**
 * How a non-streaming request reaches the backend.
 */
public enum BatchStrategy {
	/** Straight to a backend that batches internally; no local queuing. */
	CONTINUOUS,
	/** The request's own prompts as one backend call. */
	STATIC,
	/** Combined with concurrently arriving single-prompt requests that share the same options. */
	DYNAMIC
}

package de.kherud.serve.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Wraps any failure reported by a generation backend.
 */
public class BackendGenerationException extends PredictorException {

	public BackendGenerationException(String message) {
		super(message);
	}

	public BackendGenerationException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * Wraps {@code cause} unless it already is a backend failure.
	 */
	public static BackendGenerationException wrap(Throwable cause) {
		Throwable unwrapped = cause;
		while ((unwrapped instanceof CompletionException || unwrapped instanceof ExecutionException)
				&& unwrapped.getCause() != null) {
			unwrapped = unwrapped.getCause();
		}
		if (unwrapped instanceof BackendGenerationException) {
			return (BackendGenerationException) unwrapped;
		}
		return new BackendGenerationException("Backend generation failed: " + unwrapped.getMessage(), unwrapped);
	}
}

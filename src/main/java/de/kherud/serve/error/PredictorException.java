package de.kherud.serve.error;

/**
 * Base class of every failure raised by the serving front-end.
 */
public class PredictorException extends RuntimeException {

	public PredictorException(String message) {
		super(message);
	}

	public PredictorException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * HTTP-equivalent status this failure maps to when it reaches the request boundary.
	 */
	public int getStatusCode() {
		return 500;
	}
}

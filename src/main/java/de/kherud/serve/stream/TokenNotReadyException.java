package de.kherud.serve.stream;

/**
 * Raised by a {@link TokenSource} when the next token has not been produced yet.
 * The caller is expected to retry after a short delay.
 */
public class TokenNotReadyException extends Exception {

	public TokenNotReadyException() {
		super("Next token is not available yet", null, false, false);
	}
}

package de.kherud.serve.stream;

import org.jetbrains.annotations.Nullable;

/**
 * Pollable source of generated tokens, fed by a backend running in another thread.
 */
public interface TokenSource extends AutoCloseable {

	/**
	 * @return the next token, or {@code null} once the source is exhausted
	 * @throws TokenNotReadyException if no token is available yet
	 * @throws InterruptedException if the polling thread was interrupted
	 */
	@Nullable
	String pollToken() throws TokenNotReadyException, InterruptedException;

	/**
	 * Prompt token count of the streamed request, {@code 0} while unknown.
	 */
	default int getInputLength() {
		return 0;
	}

	@Override
	void close();
}

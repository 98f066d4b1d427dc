package de.kherud.serve.stream;

import java.util.Iterator;

/**
 * Lazy, finite and non-restartable sequence of tokens for one request. Closing it early releases the
 * underlying token channel; once closed or exhausted, {@link #hasNext()} stays {@code false}.
 */
public interface TokenStream extends Iterator<StreamToken>, AutoCloseable {

	@Override
	void close();
}

package de.kherud.serve.response;

import java.util.Iterator;
import java.util.List;

/**
 * Sequence of envelopes produced for one call of the OpenAI-compatible path.
 */
public interface EnvelopeStream extends Iterator<ResponseEnvelope>, AutoCloseable {

	@Override
	void close();

	static EnvelopeStream single(ResponseEnvelope envelope) {
		Iterator<ResponseEnvelope> delegate = List.of(envelope).iterator();
		return new EnvelopeStream() {
			@Override
			public boolean hasNext() {
				return delegate.hasNext();
			}

			@Override
			public ResponseEnvelope next() {
				return delegate.next();
			}

			@Override
			public void close() {
			}
		};
	}
}

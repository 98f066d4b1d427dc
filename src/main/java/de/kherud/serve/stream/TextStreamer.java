package de.kherud.serve.stream;

/**
 * Sink a synchronous backend pushes generated text into while it runs.
 */
public interface TextStreamer {

	void put(String text);

	/**
	 * Signals that generation finished normally. Calling it more than once has no effect.
	 */
	void end();

	void fail(Throwable cause);

	/**
	 * Records the prompt token count of the request being streamed, once the backend knows it.
	 */
	default void setInputLength(int inputLength) {
	}
}

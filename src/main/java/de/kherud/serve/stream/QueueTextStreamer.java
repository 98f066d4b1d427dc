package de.kherud.serve.stream;

import de.kherud.serve.error.BackendGenerationException;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded token channel between a backend thread (the {@link TextStreamer} side) and a consumer
 * (the {@link TokenSource} side). Receiving waits at most the configured timeout before signalling
 * {@link TokenNotReadyException}.
 * <p>
 * Once closed by the consumer, everything the backend still pushes is dropped so the producer never blocks
 * on an abandoned stream.
 */
public class QueueTextStreamer implements TextStreamer, TokenSource {

	public static final Duration DEFAULT_RECEIVE_TIMEOUT = Duration.ofMillis(10);
	public static final int DEFAULT_CAPACITY = 1024;

	private static final Object END = new Object();
	private static final long OFFER_SLICE_MS = 50;

	private final BlockingQueue<Object> queue;
	private final long receiveTimeoutNanos;
	private volatile boolean closed = false;
	private volatile boolean ended = false;
	private volatile int inputLength = 0;
	private boolean exhausted = false;

	public QueueTextStreamer() {
		this(DEFAULT_RECEIVE_TIMEOUT, DEFAULT_CAPACITY);
	}

	public QueueTextStreamer(Duration receiveTimeout, int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("capacity must be positive");
		}
		this.queue = new ArrayBlockingQueue<>(capacity);
		this.receiveTimeoutNanos = receiveTimeout.toNanos();
	}

	@Override
	public void put(String text) {
		if (ended) {
			throw new IllegalStateException("Streamer already ended");
		}
		offer(text);
	}

	@Override
	public void end() {
		if (!ended) {
			ended = true;
			offer(END);
		}
	}

	@Override
	public void fail(Throwable cause) {
		if (!ended) {
			ended = true;
			offer(new Failure(cause));
		}
	}

	@Override
	public void setInputLength(int inputLength) {
		this.inputLength = inputLength;
	}

	@Override
	public int getInputLength() {
		return inputLength;
	}

	private void offer(Object item) {
		try {
			while (!closed) {
				if (queue.offer(item, OFFER_SLICE_MS, TimeUnit.MILLISECONDS)) {
					return;
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while publishing to the token stream", e);
		}
	}

	@Override
	@Nullable
	public String pollToken() throws TokenNotReadyException, InterruptedException {
		if (exhausted || closed) {
			return null;
		}
		Object item = receiveTimeoutNanos > 0
			? queue.poll(receiveTimeoutNanos, TimeUnit.NANOSECONDS)
			: queue.poll();
		if (item == null) {
			throw new TokenNotReadyException();
		}
		if (item == END) {
			exhausted = true;
			return null;
		}
		if (item instanceof Failure) {
			exhausted = true;
			throw BackendGenerationException.wrap(((Failure) item).cause);
		}
		return (String) item;
	}

	public boolean isClosed() {
		return closed;
	}

	@Override
	public void close() {
		closed = true;
		queue.clear();
	}

	private static final class Failure {
		final Throwable cause;

		Failure(Throwable cause) {
			this.cause = cause;
		}
	}
}

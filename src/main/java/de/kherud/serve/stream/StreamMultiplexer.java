package de.kherud.serve.stream;

import de.kherud.serve.backend.RequestOutput;
import de.kherud.serve.error.BackendGenerationException;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.locks.LockSupport;

/**
 * Turns a backend's incremental output into a {@link TokenStream} the transport can drain.
 * <p>
 * Two kinds of sources are supported:
 * <ul>
 *     <li>a pollable {@link TokenSource} fed by a synchronous backend running on another thread. When the source
 *     reports {@link TokenNotReadyException} the consumer parks for the retry delay and polls again.</li>
 *     <li>a {@link Flow.Publisher} of cumulative {@link RequestOutput} snapshots from an asynchronous backend. Only
 *     the newly generated suffix of each snapshot is emitted, as soon as it arrives.</li>
 * </ul>
 * Token order is exactly the backend's emission order.
 */
public class StreamMultiplexer {

	public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(1);

	private final long retryDelayNanos;

	public StreamMultiplexer() {
		this(DEFAULT_RETRY_DELAY);
	}

	public StreamMultiplexer(Duration retryDelay) {
		if (retryDelay.isNegative()) {
			throw new IllegalArgumentException("retryDelay must not be negative");
		}
		this.retryDelayNanos = retryDelay.toNanos();
	}

	public TokenStream fromSource(TokenSource source) {
		return new PolledTokenStream(source, retryDelayNanos);
	}

	/**
	 * Subscribes to {@code publisher}. The publisher must accept exactly one subscriber.
	 */
	public TokenStream fromPublisher(Flow.Publisher<RequestOutput> publisher) {
		PublishedTokenStream stream = new PublishedTokenStream();
		publisher.subscribe(stream);
		return stream;
	}

	static final class PolledTokenStream implements TokenStream {
		private final TokenSource source;
		private final long retryDelayNanos;
		private StreamToken pending;
		private boolean finished = false;
		private int generated = 0;

		PolledTokenStream(TokenSource source, long retryDelayNanos) {
			this.source = source;
			this.retryDelayNanos = retryDelayNanos;
		}

		@Override
		public boolean hasNext() {
			if (pending != null) {
				return true;
			}
			if (finished) {
				return false;
			}
			while (true) {
				try {
					String text = source.pollToken();
					if (text == null) {
						close();
						return false;
					}
					generated++;
					pending = new StreamToken(text, source.getInputLength(), generated);
					return true;
				} catch (TokenNotReadyException e) {
					LockSupport.parkNanos(retryDelayNanos);
					if (Thread.currentThread().isInterrupted()) {
						close();
						throw new BackendGenerationException("Interrupted while waiting for the next token");
					}
				} catch (InterruptedException e) {
					close();
					Thread.currentThread().interrupt();
					throw new BackendGenerationException("Interrupted while waiting for the next token", e);
				} catch (RuntimeException e) {
					close();
					throw BackendGenerationException.wrap(e);
				}
			}
		}

		@Override
		public StreamToken next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			StreamToken token = pending;
			pending = null;
			return token;
		}

		@Override
		public void close() {
			finished = true;
			pending = null;
			source.close();
		}
	}

	static final class PublishedTokenStream implements TokenStream, Flow.Subscriber<RequestOutput> {
		private static final Object COMPLETE = new Object();

		private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
		private volatile Flow.Subscription subscription;
		private volatile boolean closed = false;
		private StreamToken pending;
		private boolean finished = false;
		private int printed = 0;
		private int generated = 0;

		@Override
		public void onSubscribe(Flow.Subscription subscription) {
			this.subscription = subscription;
			if (closed) {
				subscription.cancel();
			} else {
				subscription.request(1);
			}
		}

		@Override
		public void onNext(RequestOutput item) {
			queue.add(item);
		}

		@Override
		public void onError(Throwable throwable) {
			queue.add(new Failure(throwable));
		}

		@Override
		public void onComplete() {
			queue.add(COMPLETE);
		}

		@Override
		public boolean hasNext() {
			if (pending != null) {
				return true;
			}
			while (!finished) {
				Object item;
				try {
					item = queue.take();
				} catch (InterruptedException e) {
					close();
					Thread.currentThread().interrupt();
					throw new BackendGenerationException("Interrupted while waiting for the next token", e);
				}
				if (item == COMPLETE) {
					close();
					return false;
				}
				if (item instanceof Failure) {
					close();
					throw BackendGenerationException.wrap(((Failure) item).cause);
				}
				RequestOutput output = (RequestOutput) item;
				if (output.finished()) {
					finished = true;
					cancelSubscription();
				} else {
					subscription.request(1);
				}
				String delta = output.text().length() > printed ? output.text().substring(printed) : "";
				if (delta.isEmpty()) {
					continue;
				}
				printed += delta.length();
				generated = Math.max(generated + 1, output.generatedTokens());
				pending = new StreamToken(delta, output.promptTokens(), generated);
				return true;
			}
			return false;
		}

		@Override
		public StreamToken next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			StreamToken token = pending;
			pending = null;
			return token;
		}

		@Override
		public void close() {
			finished = true;
			pending = null;
			closed = true;
			cancelSubscription();
			queue.clear();
		}

		private void cancelSubscription() {
			Flow.Subscription current = subscription;
			if (current != null) {
				current.cancel();
			}
		}
	}

	private static final class Failure {
		final Throwable cause;

		Failure(Throwable cause) {
			this.cause = cause;
		}
	}
}

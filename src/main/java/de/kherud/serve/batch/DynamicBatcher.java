package de.kherud.serve.batch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Groups calls arriving concurrently from many threads into bounded windows and hands each window to a
 * {@link BatchHandler} in one invocation.
 * <p>
 * Submissions are queued and drained by a single batching thread. A window opens with the first queued call and is
 * cut when it holds {@code maxBatchSize} calls or {@code batchWaitTimeout} has elapsed since it opened, whichever
 * comes first. The handler's {@code i}-th output completes the {@code i}-th call of the window. Windows are
 * dispatched without waiting for the previous one to finish.
 *
 * @param <I> call input
 * @param <O> per-call output
 */
public class DynamicBatcher<I, O> implements AutoCloseable {

	private static final System.Logger LOGGER = System.getLogger(DynamicBatcher.class.getName());

	@FunctionalInterface
	public interface BatchHandler<I, O> {
		/**
		 * @return a future of exactly one output per input, in input order
		 */
		CompletableFuture<List<O>> handle(List<I> window);
	}

	private static final class Call<I, O> {
		final I input;
		final CompletableFuture<O> future = new CompletableFuture<>();

		Call(I input) {
			this.input = input;
		}
	}

	private final int maxBatchSize;
	private final long batchWaitTimeoutNanos;
	private final BatchHandler<I, O> handler;
	private final BlockingQueue<Call<I, O>> queue = new LinkedBlockingQueue<>();
	private final Thread worker;
	private volatile boolean closed = false;

	public DynamicBatcher(String name, int maxBatchSize, Duration batchWaitTimeout, BatchHandler<I, O> handler) {
		if (maxBatchSize <= 0) {
			throw new IllegalArgumentException("maxBatchSize must be positive");
		}
		this.maxBatchSize = maxBatchSize;
		this.batchWaitTimeoutNanos = batchWaitTimeout.toNanos();
		this.handler = handler;
		this.worker = new Thread(this::run);
		this.worker.setName(name + "-batcher");
		this.worker.setDaemon(true);
		this.worker.start();
	}

	public int getMaxBatchSize() {
		return maxBatchSize;
	}

	public CompletableFuture<O> submit(I input) {
		if (closed) {
			return CompletableFuture.failedFuture(new IllegalStateException("Batcher is closed"));
		}
		Call<I, O> call = new Call<>(input);
		queue.add(call);
		if (closed && queue.remove(call)) {
			call.future.completeExceptionally(new IllegalStateException("Batcher is closed"));
		}
		return call.future;
	}

	private void run() {
		List<Call<I, O>> window = new ArrayList<>(maxBatchSize);
		while (!closed) {
			try {
				collectWindow(window);
			} catch (InterruptedException e) {
				fail(window);
				break;
			}
			dispatch(new ArrayList<>(window));
			window.clear();
		}
		failPending();
	}

	private void collectWindow(List<Call<I, O>> window) throws InterruptedException {
		window.add(queue.take());
		long deadline = System.nanoTime() + batchWaitTimeoutNanos;
		while (window.size() < maxBatchSize) {
			long remaining = deadline - System.nanoTime();
			if (remaining <= 0) {
				queue.drainTo(window, maxBatchSize - window.size());
				return;
			}
			Call<I, O> next = queue.poll(remaining, TimeUnit.NANOSECONDS);
			if (next == null) {
				return;
			}
			window.add(next);
		}
	}

	private void dispatch(List<Call<I, O>> window) {
		List<I> inputs = new ArrayList<>(window.size());
		window.forEach(call -> inputs.add(call.input));
		CompletableFuture<List<O>> outputs;
		try {
			outputs = handler.handle(inputs);
		} catch (RuntimeException e) {
			LOGGER.log(System.Logger.Level.WARNING, "Batch handler failed for window of " + window.size(), e);
			window.forEach(call -> call.future.completeExceptionally(e));
			return;
		}
		outputs.whenComplete((results, error) -> {
			if (error != null) {
				window.forEach(call -> call.future.completeExceptionally(error));
			} else if (results == null || results.size() != window.size()) {
				IllegalStateException mismatch = new IllegalStateException(String.format(
					"Batch handler returned %d outputs for a window of %d",
					results == null ? 0 : results.size(), window.size()));
				window.forEach(call -> call.future.completeExceptionally(mismatch));
			} else {
				for (int i = 0; i < window.size(); i++) {
					window.get(i).future.complete(results.get(i));
				}
			}
		});
	}

	private void failPending() {
		List<Call<I, O>> pending = new ArrayList<>();
		queue.drainTo(pending);
		fail(pending);
	}

	private void fail(List<Call<I, O>> calls) {
		calls.forEach(call -> call.future.completeExceptionally(new IllegalStateException("Batcher is closed")));
	}

	@Override
	public void close() {
		closed = true;
		worker.interrupt();
		try {
			worker.join(TimeUnit.SECONDS.toMillis(1));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		failPending();
	}
}

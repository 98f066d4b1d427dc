package de.kherud.serve.batch;

import de.kherud.serve.backend.GenerationResult;
import de.kherud.serve.backend.Predictor;
import de.kherud.serve.error.BackendGenerationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Combines single-prompt requests from independent callers into shared backend calls.
 * <p>
 * Each window admitted by the {@link DynamicBatcher} is partitioned by {@link BatchKey}; every group goes to the
 * backend as one {@link Predictor#generate} call with its prompts in window order, and each result is written back
 * to the slot of the caller that submitted it. A failing group only fails its own callers: they receive a
 * {@link BatchOutcome#failure} while the other groups of the window complete normally.
 */
public class DynamicBatchAccumulator implements AutoCloseable {

	private static final System.Logger LOGGER = System.getLogger(DynamicBatchAccumulator.class.getName());

	private record Submission(String prompt, BatchKey batchKey) {
	}

	private final Predictor predictor;
	private final Executor executor;
	private final DynamicBatcher<Submission, BatchOutcome> batcher;

	/**
	 * @param executor runs the blocking backend calls, one task per group
	 */
	public DynamicBatchAccumulator(Predictor predictor, Executor executor, int maxBatchSize, Duration batchWaitTimeout) {
		this.predictor = predictor;
		this.executor = executor;
		this.batcher = new DynamicBatcher<>("dynamic-batch", maxBatchSize, batchWaitTimeout, this::handleWindow);
	}

	/**
	 * Queues one prompt for the next window. The future never completes with {@code null}.
	 */
	public CompletableFuture<BatchOutcome> submit(String prompt, BatchKey batchKey) {
		return batcher.submit(new Submission(prompt, batchKey));
	}

	private CompletableFuture<List<BatchOutcome>> handleWindow(List<Submission> window) {
		List<PendingBatchEntry> entries = new ArrayList<>(window.size());
		for (int i = 0; i < window.size(); i++) {
			Submission submission = window.get(i);
			entries.add(new PendingBatchEntry(i, submission.prompt(), submission.batchKey()));
		}
		return flush(entries);
	}

	/**
	 * Runs one window: one backend call per distinct {@link BatchKey}, results scattered by
	 * {@link PendingBatchEntry#requestIndex()}. The returned list has one outcome per entry, indexed like the window.
	 */
	public CompletableFuture<List<BatchOutcome>> flush(List<PendingBatchEntry> entries) {
		LOGGER.log(System.Logger.Level.INFO, String.format("Handling dynamic batch (size=%d) ...", entries.size()));

		Map<BatchKey, List<PendingBatchEntry>> groups = new LinkedHashMap<>();
		for (PendingBatchEntry entry : entries) {
			if (entry.requestIndex() < 0 || entry.requestIndex() >= entries.size()) {
				throw new IllegalArgumentException("Request index " + entry.requestIndex()
					+ " outside of a window of " + entries.size());
			}
			groups.computeIfAbsent(entry.batchKey(), key -> new ArrayList<>()).add(entry);
		}
		LOGGER.log(System.Logger.Level.DEBUG, () -> String.format("Window split into %d group(s): %s",
			groups.size(), groups.keySet()));

		BatchOutcome[] results = new BatchOutcome[entries.size()];
		List<CompletableFuture<Void>> calls = new ArrayList<>(groups.size());
		for (Map.Entry<BatchKey, List<PendingBatchEntry>> group : groups.entrySet()) {
			BatchKey key = group.getKey();
			List<PendingBatchEntry> members = group.getValue();
			calls.add(generate(key, members)
				.handle((generated, error) -> {
					scatter(key, members, generated, error, results);
					return null;
				}));
		}
		groups.clear();
		return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]))
			.thenApply(ignored -> Arrays.asList(results));
	}

	private CompletableFuture<List<GenerationResult>> generate(BatchKey key, List<PendingBatchEntry> group) {
		List<String> prompts = new ArrayList<>(group.size());
		group.forEach(entry -> prompts.add(entry.prompt()));
		try {
			return CompletableFuture.supplyAsync(() -> predictor.generate(prompts, key.config()), executor);
		} catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}
	}

	private static void scatter(BatchKey key, List<PendingBatchEntry> group, List<GenerationResult> generated,
								Throwable error, BatchOutcome[] results) {
		BackendGenerationException failure = null;
		if (error != null) {
			failure = BackendGenerationException.wrap(error);
		} else if (generated == null || generated.size() != group.size()) {
			failure = new BackendGenerationException(String.format("Backend returned %d results for %d prompts",
				generated == null ? 0 : generated.size(), group.size()));
		}
		if (failure != null) {
			LOGGER.log(System.Logger.Level.WARNING, String.format("Batch group %s (size=%d) failed: %s",
				key, group.size(), failure.getMessage()));
			for (PendingBatchEntry entry : group) {
				results[entry.requestIndex()] = BatchOutcome.failure(failure);
			}
			return;
		}
		for (int i = 0; i < group.size(); i++) {
			results[group.get(i).requestIndex()] = BatchOutcome.success(generated.get(i));
		}
	}

	@Override
	public void close() {
		batcher.close();
	}
}

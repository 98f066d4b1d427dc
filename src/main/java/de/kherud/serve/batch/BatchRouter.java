package de.kherud.serve.batch;

import de.kherud.serve.backend.BackendKind;
import de.kherud.serve.backend.GenerationResult;
import de.kherud.serve.backend.Predictor;
import de.kherud.serve.error.BackendGenerationException;
import de.kherud.serve.prompt.NormalizedPrompt;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Picks the batching strategy for a non-streaming request and drives it to completion.
 */
public class BatchRouter {

	private static final System.Logger LOGGER = System.getLogger(BatchRouter.class.getName());

	private final Predictor predictor;
	private final DynamicBatchAccumulator accumulator;
	private final Executor executor;

	public BatchRouter(Predictor predictor, DynamicBatchAccumulator accumulator, Executor executor) {
		this.predictor = predictor;
		this.accumulator = accumulator;
		this.executor = executor;
	}

	/**
	 * Strategy selection depends only on the backend kind and the prompt's shape. A prompt carrying images is never
	 * merged with other callers, since the images belong to it alone.
	 */
	public static BatchStrategy select(BackendKind kind, NormalizedPrompt prompt) {
		if (kind.batchesContinuously()) {
			return BatchStrategy.CONTINUOUS;
		}
		if (prompt.size() > 1 || prompt.hasImages()) {
			return BatchStrategy.STATIC;
		}
		return BatchStrategy.DYNAMIC;
	}

	/**
	 * @return one result per prompt, in prompt order; completes exceptionally with a
	 * {@link BackendGenerationException} when the backend fails
	 */
	public CompletableFuture<List<GenerationResult>> route(NormalizedPrompt prompt, Map<String, Object> config) {
		BatchStrategy strategy = select(predictor.getKind(), prompt);
		LOGGER.log(System.Logger.Level.DEBUG, () -> "Routing " + prompt + " with strategy " + strategy);
		CompletableFuture<List<GenerationResult>> results;
		switch (strategy) {
			case CONTINUOUS:
				results = invoke(() -> predictor.generateAsync(prompt.getPrompts(), config));
				break;
			case STATIC:
				LOGGER.log(System.Logger.Level.INFO, String.format("Handling static batch (size=%d) ...", prompt.size()));
				results = invoke(() -> CompletableFuture.supplyAsync(() -> prompt.hasImages()
					? predictor.generate(prompt.getImages(), prompt.getPrompts(), config)
					: predictor.generate(prompt.getPrompts(), config), executor));
				break;
			case DYNAMIC:
				results = accumulator.submit(prompt.getPrompt(), BatchKey.of(config))
					.thenApply(outcome -> List.of(outcome.getOrThrow()));
				break;
			default:
				throw new IllegalStateException("Unknown strategy " + strategy);
		}
		return results.handle((generated, error) -> {
			if (error != null) {
				throw BackendGenerationException.wrap(error);
			}
			if (generated == null || generated.size() != prompt.size()) {
				throw new BackendGenerationException(String.format("Backend returned %d results for %d prompts",
					generated == null ? 0 : generated.size(), prompt.size()));
			}
			return generated;
		});
	}

	private interface Call {
		CompletableFuture<List<GenerationResult>> start();
	}

	private static CompletableFuture<List<GenerationResult>> invoke(Call call) {
		try {
			return call.start();
		} catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}
	}
}

package de.kherud.serve.backend;

import de.kherud.serve.stream.QueueTextStreamer;
import de.kherud.serve.stream.TextStreamer;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

/**
 * Adapter around one generation backend. Every variant implements the synchronous operations;
 * {@link BackendKind#CONTINUOUS_BATCH} backends additionally implement the asynchronous ones and
 * {@link BackendKind#MULTIMODAL} backends the image-accepting overloads.
 * <p>
 * {@code config} holds the generation options of one request (e.g. {@code max_new_tokens}, {@code temperature})
 * and is passed through untouched.
 */
public interface Predictor extends AutoCloseable {

	BackendKind getKind();

	/**
	 * Generates one result per prompt, in prompt order.
	 */
	List<GenerationResult> generate(List<String> prompts, Map<String, Object> config);

	default List<GenerationResult> generate(List<String> images, List<String> prompts, Map<String, Object> config) {
		if (images.isEmpty()) {
			return generate(prompts, config);
		}
		throw new UnsupportedOperationException(getKind() + " backend does not accept images");
	}

	default CompletableFuture<List<GenerationResult>> generateAsync(List<String> prompts, Map<String, Object> config) {
		return CompletableFuture.failedFuture(
			new UnsupportedOperationException(getKind() + " backend has no asynchronous generation"));
	}

	/**
	 * Runs generation to completion, pushing each token into {@code streamer}. Blocks the calling thread.
	 */
	void streamingGenerate(List<String> prompts, TextStreamer streamer, Map<String, Object> config);

	default void streamingGenerate(List<String> images, List<String> prompts, TextStreamer streamer,
								   Map<String, Object> config) {
		if (images.isEmpty()) {
			streamingGenerate(prompts, streamer, config);
			return;
		}
		throw new UnsupportedOperationException(getKind() + " backend does not accept images");
	}

	/**
	 * Starts streaming generation for one prompt. The returned publisher emits cumulative snapshots.
	 */
	default CompletableFuture<Flow.Publisher<RequestOutput>> streamingGenerateAsync(String prompt, Map<String, Object> config) {
		return CompletableFuture.failedFuture(
			new UnsupportedOperationException(getKind() + " backend has no asynchronous streaming"));
	}

	/**
	 * Obtains a fresh token channel for one streaming call.
	 */
	default QueueTextStreamer getStreamer() {
		return new QueueTextStreamer();
	}

	/**
	 * Prompt token count of the most recent request, {@code 0} while unknown.
	 */
	int getInputLength();

	@Override
	default void close() {
	}
}

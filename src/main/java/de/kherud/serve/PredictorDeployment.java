package de.kherud.serve;

import com.fasterxml.jackson.databind.JsonNode;
import de.kherud.serve.backend.BackendKind;
import de.kherud.serve.backend.GenerationResult;
import de.kherud.serve.backend.Predictor;
import de.kherud.serve.backend.PredictorFactory;
import de.kherud.serve.batch.BatchRouter;
import de.kherud.serve.batch.DynamicBatchAccumulator;
import de.kherud.serve.config.InferenceConfig;
import de.kherud.serve.error.BackendGenerationException;
import de.kherud.serve.error.ErrorKind;
import de.kherud.serve.error.InvalidRequestException;
import de.kherud.serve.prompt.ChatProcessor;
import de.kherud.serve.prompt.ChatProcessors;
import de.kherud.serve.prompt.NormalizedPrompt;
import de.kherud.serve.prompt.PromptNormalizer;
import de.kherud.serve.prompt.PromptResult;
import de.kherud.serve.response.EnvelopeStream;
import de.kherud.serve.response.ResponseEnvelope;
import de.kherud.serve.response.ResponseEnvelopeBuilder;
import de.kherud.serve.stream.QueueTextStreamer;
import de.kherud.serve.stream.StreamMultiplexer;
import de.kherud.serve.stream.TokenStream;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Request front-end of one model deployment.
 * <p>
 * The backend kind is resolved from the configuration once and the backend adapter is built for it; both stay fixed
 * for the lifetime of the deployment. A call is parsed, its prompt normalized, and then either streamed token by
 * token (single prompt only) or routed through the continuous, static or dynamic batching strategy.
 * <p>
 * Request-shape errors never escape {@link #call(String)}: they become 400 responses. Backend failures become 500
 * responses before a stream starts; once it has started they truncate it.
 */
public class PredictorDeployment implements AutoCloseable {

	private static final System.Logger LOGGER = System.getLogger(PredictorDeployment.class.getName());

	private final InferenceConfig config;
	private final BackendKind kind;
	private final Predictor predictor;
	private final PromptNormalizer normalizer;
	private final ExecutorService executor;
	private final DynamicBatchAccumulator accumulator;
	private final BatchRouter router;
	private final StreamMultiplexer multiplexer;

	/**
	 * @throws de.kherud.serve.error.ChatProcessorNotFoundException if the configured chat processor does not exist
	 */
	public PredictorDeployment(InferenceConfig config, PredictorFactory factory) {
		this.config = config;
		ChatProcessor processor = ChatProcessors.create(config.getName(), config.getModelDescription());
		this.normalizer = new PromptNormalizer(processor);
		this.kind = resolveKind(config);
		this.predictor = factory.create(kind, config);
		if (predictor.getKind() != kind) {
			throw new IllegalStateException("Factory built a " + predictor.getKind() + " backend, expected " + kind);
		}
		this.executor = createExecutor(config.getName());
		this.accumulator = new DynamicBatchAccumulator(predictor, executor,
			config.getMaxBatchSize(), config.getBatchWaitTimeout());
		this.router = new BatchRouter(predictor, accumulator, executor);
		this.multiplexer = new StreamMultiplexer(config.getStreamPollInterval());
		LOGGER.log(System.Logger.Level.INFO, String.format("Deployment %s started with %s backend (max_batch_size=%d)",
			config.getName(), kind, config.getMaxBatchSize()));
	}

	public static BackendKind resolveKind(InferenceConfig config) {
		if (config.isDeepspeed()) {
			return BackendKind.SHARDED;
		}
		if (config.getVllm().isEnabled()) {
			return BackendKind.CONTINUOUS_BATCH;
		}
		if (ChatProcessors.isMultimodal(config.getModelDescription().getChatProcessor())) {
			return BackendKind.MULTIMODAL;
		}
		return BackendKind.SINGLE_PROCESS;
	}

	private static ExecutorService createExecutor(String name) {
		ThreadFactory threadFactory = new ThreadFactory() {
			private final AtomicInteger counter = new AtomicInteger(0);

			@Override
			public Thread newThread(Runnable r) {
				Thread thread = new Thread(r);
				thread.setName(name + "-generate-" + counter.getAndIncrement());
				thread.setDaemon(true);
				return thread;
			}
		};
		return Executors.newCachedThreadPool(threadFactory);
	}

	public BackendKind getKind() {
		return kind;
	}

	public Predictor getPredictor() {
		return predictor;
	}

	public InferenceConfig getConfig() {
		return config;
	}

	/**
	 * Handles one plain generation call and waits for its response. Streaming responses return as soon as the stream
	 * is set up.
	 */
	public PredictorResponse call(String body) {
		return callAsync(body).join();
	}

	/**
	 * Handles one plain generation call. The returned future never completes exceptionally.
	 */
	public CompletableFuture<PredictorResponse> callAsync(String body) {
		GenerationRequest request;
		try {
			request = GenerationRequest.parse(body);
		} catch (InvalidRequestException e) {
			return CompletableFuture.completedFuture(badRequest(e.getKind()));
		}
		return handle(request);
	}

	public CompletableFuture<PredictorResponse> handle(GenerationRequest request) {
		if (request.isTextEmpty()) {
			return CompletableFuture.completedFuture(badRequest(ErrorKind.EMPTY_PROMPT));
		}
		CompletableFuture<PredictorResponse> response = request.isStream()
			? handleStreaming(request.getText(), request.getConfig())
			: handleNonStreaming(request.getText(), request.getConfig());
		return response.exceptionally(error -> {
			Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
			if (cause instanceof InvalidRequestException) {
				return badRequest(((InvalidRequestException) cause).getKind());
			}
			BackendGenerationException failure = BackendGenerationException.wrap(cause);
			LOGGER.log(System.Logger.Level.WARNING, "Generation failed: " + failure.getMessage(), failure);
			return PredictorResponse.error(failure.getStatusCode(), failure.getMessage());
		});
	}

	private CompletableFuture<PredictorResponse> handleStreaming(JsonNode text, Map<String, Object> generationConfig) {
		PromptResult normalized = normalizer.normalize(newRequestId(), text, false);
		if (!normalized.isValid()) {
			return CompletableFuture.completedFuture(badRequest(normalized.getError()));
		}
		NormalizedPrompt prompt = normalized.get();
		if (prompt.size() > 1) {
			return CompletableFuture.completedFuture(badRequest(ErrorKind.STREAMING_WITH_MULTIPLE_PROMPTS_UNSUPPORTED));
		}
		return startStream(prompt, generationConfig).thenApply(PredictorResponse::stream);
	}

	private CompletableFuture<PredictorResponse> handleNonStreaming(JsonNode text, Map<String, Object> generationConfig) {
		boolean returnAsSequence = kind.batchesContinuously() || normalizer.hasProcessor();
		PromptResult normalized = normalizer.normalize(newRequestId(), text, returnAsSequence);
		if (!normalized.isValid()) {
			return CompletableFuture.completedFuture(badRequest(normalized.getError()));
		}
		NormalizedPrompt prompt = normalized.get();
		return router.route(prompt, generationConfig).thenApply(results -> {
			List<ResponseEnvelope> envelopes = ResponseEnvelopeBuilder.fromResults(results);
			return PredictorResponse.json(prompt.isSequence() ? envelopes : envelopes.get(0));
		});
	}

	/**
	 * OpenAI-compatible call path. Accepts a single prompt or one conversation and returns one envelope, or one
	 * envelope per generated token when {@code streaming}.
	 *
	 * @throws InvalidRequestException for a list of flat prompts or an unrecognisable prompt
	 * @throws BackendGenerationException if the backend fails before any output is produced
	 */
	public EnvelopeStream openaiCall(JsonNode prompt, Map<String, Object> generationConfig, boolean streaming) {
		NormalizedPrompt normalized = normalizer.normalizeConversation(newRequestId(), prompt).get();
		try {
			if (!streaming) {
				List<GenerationResult> results;
				if (kind.batchesContinuously()) {
					results = predictor.generateAsync(normalized.getPrompts(), generationConfig).join();
				} else {
					results = predictor.generate(normalized.getImages(), normalized.getPrompts(), generationConfig);
				}
				if (results.isEmpty()) {
					throw new BackendGenerationException("Backend returned no result");
				}
				return EnvelopeStream.single(ResponseEnvelopeBuilder.fromResult(results.get(0)));
			}
			TokenStream tokens = startStream(normalized, generationConfig).join();
			return ResponseEnvelopeBuilder.stream(tokens, predictor::getInputLength);
		} catch (CompletionException | UnsupportedOperationException e) {
			throw BackendGenerationException.wrap(e);
		}
	}

	private CompletableFuture<TokenStream> startStream(NormalizedPrompt prompt, Map<String, Object> generationConfig) {
		if (kind.batchesContinuously()) {
			try {
				return predictor.streamingGenerateAsync(prompt.getPrompt(), generationConfig)
					.thenApply(multiplexer::fromPublisher);
			} catch (RuntimeException e) {
				return CompletableFuture.failedFuture(e);
			}
		}
		QueueTextStreamer streamer = predictor.getStreamer();
		try {
			executor.execute(() -> {
				try {
					predictor.streamingGenerate(prompt.getImages(), prompt.getPrompts(), streamer, generationConfig);
					streamer.end();
				} catch (RuntimeException e) {
					LOGGER.log(System.Logger.Level.WARNING, "Streaming generation failed for " + prompt.getRequestId(), e);
					streamer.fail(e);
				}
			});
		} catch (RejectedExecutionException e) {
			streamer.close();
			return CompletableFuture.failedFuture(e);
		}
		return CompletableFuture.completedFuture(multiplexer.fromSource(streamer));
	}

	private static PredictorResponse badRequest(ErrorKind kind) {
		return PredictorResponse.error(400, kind.getMessage());
	}

	private static String newRequestId() {
		return UUID.randomUUID().toString();
	}

	@Override
	public void close() {
		accumulator.close();
		executor.shutdownNow();
		predictor.close();
		LOGGER.log(System.Logger.Level.INFO, "Deployment " + config.getName() + " closed");
	}
}

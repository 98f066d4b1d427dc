package de.kherud.serve.backend.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.kherud.serve.backend.BackendKind;
import de.kherud.serve.backend.GenerationResult;
import de.kherud.serve.backend.Predictor;
import de.kherud.serve.backend.RequestOutput;
import de.kherud.serve.config.BackendConfig;
import de.kherud.serve.error.BackendGenerationException;
import de.kherud.serve.prompt.ImageChatProcessor;
import de.kherud.serve.stream.TextStreamer;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Backend adapter that forwards generation to a running llama.cpp server through its {@code /completion} endpoint.
 * <p>
 * One HTTP request is issued per prompt. Generation options are passed through, except that
 * {@code max_new_tokens} and {@code repetition_penalty} are renamed to the server's {@code n_predict} and
 * {@code repeat_penalty}. Configured stop words are sent as {@code stop} unless the request brings its own.
 * Images are sent as base64 {@code image_data}; every {@code <image>} marker in the prompt is replaced by the
 * matching {@code [img-N]} reference.
 */
public class LlamaServerPredictor implements Predictor {

	private static final System.Logger LOGGER = System.getLogger(LlamaServerPredictor.class.getName());
	private static final ObjectMapper MAPPER = new ObjectMapper();
	private static final String DATA_PREFIX = "data: ";

	private final BackendKind kind;
	private final String serverUrl;
	private final Duration timeout;
	private final List<String> stopWords;
	private final HttpClient httpClient;
	private final ExecutorService publisherExecutor;
	private volatile int lastInputLength = 0;

	public LlamaServerPredictor(BackendKind kind, BackendConfig backend, List<String> stopWords) {
		this.kind = kind;
		String url = backend.getUrl();
		this.serverUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
		this.timeout = backend.getTimeout();
		this.stopWords = List.copyOf(stopWords);
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.build();
		AtomicInteger counter = new AtomicInteger(0);
		this.publisherExecutor = Executors.newCachedThreadPool(r -> {
			Thread t = new Thread(r);
			t.setName("llama-server-stream-" + counter.getAndIncrement());
			t.setDaemon(true);
			return t;
		});
	}

	@Override
	public BackendKind getKind() {
		return kind;
	}

	@Override
	public int getInputLength() {
		return lastInputLength;
	}

	@Override
	public List<GenerationResult> generate(List<String> prompts, Map<String, Object> config) {
		return generate(List.of(), prompts, config);
	}

	@Override
	public List<GenerationResult> generate(List<String> images, List<String> prompts, Map<String, Object> config) {
		if (!images.isEmpty() && kind != BackendKind.MULTIMODAL) {
			throw new UnsupportedOperationException(kind + " backend does not accept images");
		}
		List<GenerationResult> results = new ArrayList<>(prompts.size());
		for (String prompt : prompts) {
			HttpRequest request = completionRequest(images, prompt, config, false);
			HttpResponse<String> response;
			try {
				response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			} catch (IOException e) {
				throw new BackendGenerationException("Completion request to " + serverUrl + " failed", e);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new BackendGenerationException("Interrupted while waiting for " + serverUrl, e);
			}
			results.add(parseCompletion(response));
		}
		return results;
	}

	/**
	 * Sends all prompts at once and lets the server schedule them. Results keep prompt order.
	 */
	@Override
	public CompletableFuture<List<GenerationResult>> generateAsync(List<String> prompts, Map<String, Object> config) {
		List<CompletableFuture<GenerationResult>> pending = new ArrayList<>(prompts.size());
		for (String prompt : prompts) {
			HttpRequest request = completionRequest(List.of(), prompt, config, false);
			pending.add(httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
				.thenApply(this::parseCompletion));
		}
		return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
			.thenApply(ignored -> {
				List<GenerationResult> results = new ArrayList<>(pending.size());
				pending.forEach(future -> results.add(future.join()));
				return results;
			});
	}

	@Override
	public void streamingGenerate(List<String> prompts, TextStreamer streamer, Map<String, Object> config) {
		streamingGenerate(List.of(), prompts, streamer, config);
	}

	@Override
	public void streamingGenerate(List<String> images, List<String> prompts, TextStreamer streamer,
								  Map<String, Object> config) {
		if (!images.isEmpty() && kind != BackendKind.MULTIMODAL) {
			throw new UnsupportedOperationException(kind + " backend does not accept images");
		}
		for (String prompt : prompts) {
			HttpRequest request = completionRequest(images, prompt, config, true);
			HttpResponse<Stream<String>> response;
			try {
				response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
			} catch (IOException e) {
				throw new BackendGenerationException("Streaming request to " + serverUrl + " failed", e);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new BackendGenerationException("Interrupted while waiting for " + serverUrl, e);
			}
			try (Stream<String> lines = response.body()) {
				if (response.statusCode() != 200) {
					throw new BackendGenerationException("Server returned status " + response.statusCode());
				}
				Iterator<String> iterator = lines.iterator();
				while (iterator.hasNext()) {
					JsonNode event = parseEvent(iterator.next());
					if (event == null) {
						continue;
					}
					updateInputLength(event, streamer);
					String content = event.path("content").asText("");
					if (!content.isEmpty()) {
						streamer.put(content);
					}
					if (event.path("stop").asBoolean(false)) {
						break;
					}
				}
			}
		}
	}

	/**
	 * The returned publisher is cold and accepts a single subscriber: the HTTP request starts on subscription and
	 * stops reading once the subscriber cancels.
	 */
	@Override
	public CompletableFuture<Flow.Publisher<RequestOutput>> streamingGenerateAsync(String prompt, Map<String, Object> config) {
		HttpRequest request = completionRequest(List.of(), prompt, config, true);
		AtomicBoolean subscribed = new AtomicBoolean(false);
		Flow.Publisher<RequestOutput> publisher = subscriber -> {
			if (!subscribed.compareAndSet(false, true)) {
				subscriber.onSubscribe(new Flow.Subscription() {
					@Override
					public void request(long n) {
					}

					@Override
					public void cancel() {
					}
				});
				subscriber.onError(new IllegalStateException("Stream already has a subscriber"));
				return;
			}
			SubmissionPublisher<RequestOutput> outputs = new SubmissionPublisher<>(publisherExecutor, 16);
			outputs.subscribe(subscriber);
			publisherExecutor.execute(() -> publish(request, outputs));
		};
		return CompletableFuture.completedFuture(publisher);
	}

	private void publish(HttpRequest request, SubmissionPublisher<RequestOutput> outputs) {
		try {
			HttpResponse<Stream<String>> response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
			try (Stream<String> lines = response.body()) {
				if (response.statusCode() != 200) {
					throw new BackendGenerationException("Server returned status " + response.statusCode());
				}
				StringBuilder text = new StringBuilder();
				int promptTokens = 0;
				int generated = 0;
				Iterator<String> iterator = lines.iterator();
				while (iterator.hasNext() && outputs.hasSubscribers()) {
					JsonNode event = parseEvent(iterator.next());
					if (event == null) {
						continue;
					}
					text.append(event.path("content").asText(""));
					generated = event.path("tokens_predicted").asInt(generated + 1);
					promptTokens = event.path("tokens_evaluated").asInt(promptTokens);
					if (promptTokens > 0) {
						lastInputLength = promptTokens;
					}
					boolean stop = event.path("stop").asBoolean(false);
					outputs.submit(new RequestOutput(text.toString(), promptTokens, generated, stop));
					if (stop) {
						break;
					}
				}
			}
			outputs.close();
		} catch (IOException | RuntimeException e) {
			outputs.closeExceptionally(e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			outputs.closeExceptionally(e);
		}
	}

	private HttpRequest completionRequest(List<String> images, String prompt, Map<String, Object> config, boolean stream) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("prompt", images.isEmpty() ? prompt : referenceImages(prompt));
		body.put("stream", stream);
		if (!stopWords.isEmpty()) {
			body.put("stop", stopWords);
		}
		config.forEach((key, value) -> {
			switch (key) {
				case "max_new_tokens":
					body.put("n_predict", value);
					break;
				case "repetition_penalty":
					body.put("repeat_penalty", value);
					break;
				case "stream":
				case "prompt":
					break;
				default:
					body.put(key, value);
					break;
			}
		});
		if (!images.isEmpty()) {
			List<Map<String, Object>> imageData = new ArrayList<>(images.size());
			for (int i = 0; i < images.size(); i++) {
				imageData.add(Map.of("data", toBase64(images.get(i)), "id", i));
			}
			body.put("image_data", imageData);
		}
		String json;
		try {
			json = MAPPER.writeValueAsString(body);
		} catch (JsonProcessingException e) {
			throw new BackendGenerationException("Generation options are not serializable", e);
		}
		LOGGER.log(System.Logger.Level.DEBUG, () -> "POST " + serverUrl + "/completion " + json);
		return HttpRequest.newBuilder()
			.uri(URI.create(serverUrl + "/completion"))
			.header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(json))
			.timeout(timeout)
			.build();
	}

	private static String referenceImages(String prompt) {
		StringBuilder out = new StringBuilder();
		int id = 0;
		int from = 0;
		int at;
		while ((at = prompt.indexOf(ImageChatProcessor.IMAGE_TOKEN, from)) >= 0) {
			out.append(prompt, from, at).append("[img-").append(id++).append(']');
			from = at + ImageChatProcessor.IMAGE_TOKEN.length();
		}
		return out.append(prompt.substring(from)).toString();
	}

	private String toBase64(String image) {
		if (image.startsWith("data:")) {
			int comma = image.indexOf(',');
			return comma >= 0 ? image.substring(comma + 1) : image;
		}
		if (image.startsWith("http://") || image.startsWith("https://")) {
			HttpRequest request = HttpRequest.newBuilder().uri(URI.create(image)).timeout(timeout).GET().build();
			try {
				HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
				if (response.statusCode() != 200) {
					throw new BackendGenerationException("Could not fetch image " + image + ": status " + response.statusCode());
				}
				return Base64.getEncoder().encodeToString(response.body());
			} catch (IOException e) {
				throw new BackendGenerationException("Could not fetch image " + image, e);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new BackendGenerationException("Interrupted while fetching image " + image, e);
			}
		}
		return image;
	}

	private GenerationResult parseCompletion(HttpResponse<String> response) {
		if (response.statusCode() != 200) {
			throw new BackendGenerationException("Server returned status " + response.statusCode() + ": " + response.body());
		}
		JsonNode root;
		try {
			root = MAPPER.readTree(response.body());
		} catch (JsonProcessingException e) {
			throw new BackendGenerationException("Server returned malformed JSON", e);
		}
		int inputLength = root.path("tokens_evaluated").asInt(0);
		if (inputLength > 0) {
			lastInputLength = inputLength;
		}
		return new GenerationResult(root.path("content").asText(""), inputLength, root.path("tokens_predicted").asInt(0));
	}

	private static JsonNode parseEvent(String line) {
		if (!line.startsWith(DATA_PREFIX)) {
			return null;
		}
		try {
			return MAPPER.readTree(line.substring(DATA_PREFIX.length()));
		} catch (JsonProcessingException e) {
			throw new BackendGenerationException("Server sent a malformed event: " + line, e);
		}
	}

	private void updateInputLength(JsonNode event, TextStreamer streamer) {
		int inputLength = event.path("tokens_evaluated").asInt(0);
		if (inputLength > 0) {
			lastInputLength = inputLength;
			streamer.setInputLength(inputLength);
		}
	}

	@Override
	public void close() {
		publisherExecutor.shutdown();
		try {
			if (!publisherExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
				publisherExecutor.shutdownNow();
			}
		} catch (InterruptedException e) {
			publisherExecutor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}

package de.kherud.serve.backend.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import de.kherud.serve.backend.BackendKind;
import de.kherud.serve.backend.GenerationResult;
import de.kherud.serve.backend.RequestOutput;
import de.kherud.serve.config.BackendConfig;
import de.kherud.serve.error.BackendGenerationException;
import de.kherud.serve.stream.QueueTextStreamer;
import de.kherud.serve.stream.StreamMultiplexer;
import de.kherud.serve.stream.TokenStream;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Runs the adapter against a stub of the llama.cpp {@code /completion} endpoint.
 */
public class LlamaServerPredictorTest {

	private static final ObjectMapper MAPPER = new ObjectMapper();
	private static final List<String> TOKENS = List.of("Once", " upon", " a", " time");

	private final List<JsonNode> requests = Collections.synchronizedList(new ArrayList<>());
	private HttpServer server;
	private LlamaServerPredictor predictor;
	private volatile int status = 200;

	@Before
	public void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/completion", this::complete);
		server.start();
		predictor = predictor(BackendKind.SINGLE_PROCESS);
	}

	@After
	public void tearDown() {
		predictor.close();
		server.stop(0);
	}

	private LlamaServerPredictor predictor(BackendKind kind) {
		BackendConfig backend = new BackendConfig()
			.setUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/")
			.setTimeoutSeconds(10);
		return new LlamaServerPredictor(kind, backend, List.of("</s>"));
	}

	private void complete(HttpExchange exchange) throws IOException {
		JsonNode request;
		try (InputStream in = exchange.getRequestBody()) {
			request = MAPPER.readTree(in);
		}
		requests.add(request);
		if (status != 200) {
			exchange.sendResponseHeaders(status, -1);
			exchange.close();
			return;
		}
		String prompt = request.get("prompt").asText();
		if (!request.path("stream").asBoolean()) {
			Map<String, Object> body = new LinkedHashMap<>();
			body.put("content", "Echo " + prompt);
			body.put("tokens_evaluated", prompt.length());
			body.put("tokens_predicted", 2);
			body.put("stop", true);
			byte[] bytes = MAPPER.writeValueAsBytes(body);
			exchange.getResponseHeaders().set("Content-Type", "application/json");
			exchange.sendResponseHeaders(200, bytes.length);
			try (OutputStream out = exchange.getResponseBody()) {
				out.write(bytes);
			}
			return;
		}
		exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
		exchange.sendResponseHeaders(200, 0);
		try (OutputStream out = exchange.getResponseBody()) {
			for (int i = 0; i < TOKENS.size(); i++) {
				Map<String, Object> event = new LinkedHashMap<>();
				event.put("content", TOKENS.get(i));
				event.put("stop", false);
				event.put("tokens_predicted", i + 1);
				writeEvent(out, event);
			}
			Map<String, Object> last = new LinkedHashMap<>();
			last.put("content", "");
			last.put("stop", true);
			last.put("tokens_evaluated", 9);
			last.put("tokens_predicted", TOKENS.size());
			writeEvent(out, last);
		}
	}

	private static void writeEvent(OutputStream out, Map<String, Object> event) throws IOException {
		out.write(("data: " + MAPPER.writeValueAsString(event) + "\n\n").getBytes(StandardCharsets.UTF_8));
		out.flush();
	}

	@Test
	public void testGenerateTranslatesOptions() {
		Map<String, Object> config = new LinkedHashMap<>();
		config.put("max_new_tokens", 16);
		config.put("repetition_penalty", 1.1);
		config.put("temperature", 0.2);
		List<GenerationResult> results = predictor.generate(List.of("first", "second"), config);

		assertEquals(List.of(new GenerationResult("Echo first", 5, 2), new GenerationResult("Echo second", 6, 2)), results);
		assertEquals(6, predictor.getInputLength());

		JsonNode sent = requests.get(0);
		assertEquals("first", sent.get("prompt").asText());
		assertFalse(sent.get("stream").asBoolean());
		assertEquals(16, sent.get("n_predict").asInt());
		assertEquals(1.1, sent.get("repeat_penalty").asDouble(), 1e-9);
		assertEquals(0.2, sent.get("temperature").asDouble(), 1e-9);
		assertFalse(sent.has("max_new_tokens"));
		assertEquals("</s>", sent.get("stop").get(0).asText());
	}

	@Test
	public void testGenerateAsyncKeepsOrder() throws Exception {
		List<GenerationResult> results = predictor.generateAsync(List.of("a", "bb", "ccc"), Map.of())
			.get(10, TimeUnit.SECONDS);
		assertEquals("Echo a", results.get(0).text());
		assertEquals("Echo bb", results.get(1).text());
		assertEquals("Echo ccc", results.get(2).text());
	}

	@Test
	public void testServerErrorBecomesBackendFailure() {
		status = 503;
		try {
			predictor.generate(List.of("x"), Map.of());
			fail("Expected BackendGenerationException");
		} catch (BackendGenerationException e) {
			assertTrue(e.getMessage().contains("503"));
		}
	}

	@Test
	public void testStreamingPushesTokens() throws Exception {
		QueueTextStreamer streamer = new QueueTextStreamer();
		predictor.streamingGenerate(List.of("story"), streamer, Map.of());
		streamer.end();

		StringBuilder text = new StringBuilder();
		try (TokenStream tokens = new StreamMultiplexer().fromSource(streamer)) {
			while (tokens.hasNext()) {
				text.append(tokens.next().text());
			}
		}
		assertEquals("Once upon a time", text.toString());
		assertEquals(9, streamer.getInputLength());
		assertTrue(requests.get(0).get("stream").asBoolean());
	}

	@Test
	public void testAsyncStreamingPublishesCumulativeText() throws Exception {
		Flow.Publisher<RequestOutput> publisher = predictor.streamingGenerateAsync("story", Map.of())
			.get(10, TimeUnit.SECONDS);
		StringBuilder text = new StringBuilder();
		try (TokenStream tokens = new StreamMultiplexer().fromPublisher(publisher)) {
			while (tokens.hasNext()) {
				text.append(tokens.next().text());
			}
		}
		assertEquals("Once upon a time", text.toString());
		assertEquals(9, predictor.getInputLength());
	}

	@Test
	public void testImagesAreReferencedInPrompt() {
		LlamaServerPredictor multimodal = predictor(BackendKind.MULTIMODAL);
		try {
			multimodal.generate(List.of("data:image/png;base64,iVBORw0KGgo="), List.of("USER: <image>\nWhat is this?"), Map.of());
		} finally {
			multimodal.close();
		}
		JsonNode sent = requests.get(0);
		assertEquals("USER: [img-0]\nWhat is this?", sent.get("prompt").asText());
		assertEquals("iVBORw0KGgo=", sent.get("image_data").get(0).get("data").asText());
		assertEquals(0, sent.get("image_data").get(0).get("id").asInt());
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testTextBackendRejectsImages() {
		predictor.generate(List.of("data:image/png;base64,AAAA"), List.of("p"), Map.of());
	}
}

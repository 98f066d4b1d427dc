package de.kherud.serve;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.kherud.serve.backend.BackendKind;
import de.kherud.serve.config.InferenceConfig;
import de.kherud.serve.config.ModelDescription;
import de.kherud.serve.config.PromptConfig;
import de.kherud.serve.config.VllmConfig;
import de.kherud.serve.error.BackendGenerationException;
import de.kherud.serve.error.ChatProcessorNotFoundException;
import de.kherud.serve.error.ErrorKind;
import de.kherud.serve.error.InvalidRequestException;
import de.kherud.serve.response.EnvelopeStream;
import de.kherud.serve.response.ResponseEnvelope;
import de.kherud.serve.stream.TokenStream;
import de.kherud.serve.testing.FakePredictor;
import org.junit.After;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PredictorDeploymentTest {

	private static final System.Logger LOGGER = System.getLogger(PredictorDeploymentTest.class.getName());
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private PredictorDeployment deployment;
	private FakePredictor predictor;

	@After
	public void tearDown() {
		if (deployment != null) {
			deployment.close();
		}
	}

	private static InferenceConfig config() {
		return new InferenceConfig().setName("demo").setBatchWaitTimeoutMs(5);
	}

	private PredictorDeployment deploy(InferenceConfig config) {
		return deploy(config, null);
	}

	private PredictorDeployment deploy(InferenceConfig config, String failingPrompt) {
		deployment = new PredictorDeployment(config, (kind, cfg) -> {
			predictor = new FakePredictor(kind);
			if (failingPrompt != null) {
				predictor.failOn(failingPrompt);
			}
			return predictor;
		});
		return deployment;
	}

	private static String drain(TokenStream stream) {
		StringBuilder text = new StringBuilder();
		try (stream) {
			while (stream.hasNext()) {
				text.append(stream.next().text());
			}
		}
		return text.toString();
	}

	@Test
	public void testSinglePromptReturnsOneEnvelope() {
		PredictorResponse response = deploy(config()).call("{\"text\": \"Hello\"}");

		assertEquals(200, response.getStatus());
		assertFalse(response.isStreaming());
		ResponseEnvelope envelope = (ResponseEnvelope) response.getBody();
		assertEquals("Echo Hello", envelope.generatedText());
		assertEquals(5, envelope.numInputTokens());
		assertEquals(2, envelope.numGeneratedTokens());
	}

	@Test
	@SuppressWarnings("unchecked")
	public void testPromptListReturnsEnvelopesInOrder() {
		PredictorResponse response = deploy(config()).call("{\"text\": [\"p1\", \"p2\"]}");

		assertEquals(200, response.getStatus());
		List<ResponseEnvelope> envelopes = (List<ResponseEnvelope>) response.getBody();
		assertEquals(2, envelopes.size());
		assertEquals("Echo p1", envelopes.get(0).generatedText());
		assertEquals("Echo p2", envelopes.get(1).generatedText());
		// static batch: both prompts in one backend call
		assertEquals(1, predictor.getCalls().size());
	}

	@Test
	public void testGenerationOptionsReachBackend() {
		deploy(config()).call("{\"text\": \"Hello\", \"config\": {\"max_new_tokens\": 8, \"temperature\": 0.5}}");
		assertEquals(Map.of("max_new_tokens", 8L, "temperature", 0.5), predictor.getCalls().get(0).config());
	}

	@Test
	public void testStreamingMultiplePromptsIsRejected() {
		PredictorResponse response = deploy(config()).call("{\"text\": [\"p1\", \"p2\"], \"stream\": true}");
		assertEquals(400, response.getStatus());
		assertEquals(ErrorKind.STREAMING_WITH_MULTIPLE_PROMPTS_UNSUPPORTED.getMessage(), response.getBody());
		assertTrue(predictor.getCalls().isEmpty());
	}

	@Test
	public void testRequestShapeErrors() {
		deploy(config());
		assertEquals(ErrorKind.INVALID_JSON.getMessage(), deployment.call("not json").getBody());
		assertEquals(ErrorKind.INVALID_JSON.getMessage(), deployment.call("[1, 2]").getBody());
		assertEquals(ErrorKind.EMPTY_PROMPT.getMessage(), deployment.call("{\"text\": \"\"}").getBody());
		assertEquals(ErrorKind.EMPTY_PROMPT.getMessage(), deployment.call("{\"stream\": true}").getBody());
		assertEquals(ErrorKind.INVALID_PROMPT_FORMAT.getMessage(), deployment.call("{\"text\": 42}").getBody());
		assertEquals(400, deployment.call("{\"text\": [\"a\", {\"role\": \"user\", \"content\": \"b\"}]}").getStatus());
		assertTrue(predictor.getCalls().isEmpty());
	}

	@Test
	public void testStreamConcatenatesToNonStreamingText() {
		deploy(config());
		PredictorResponse streamed = deployment.call("{\"text\": \"Tell me a story\", \"stream\": true}");
		assertTrue(streamed.isStreaming());
		assertEquals(PredictorResponse.TEXT, streamed.getMediaType());
		String text = drain(streamed.getStream());

		ResponseEnvelope whole = (ResponseEnvelope) deployment.call("{\"text\": \"Tell me a story\"}").getBody();
		assertEquals(whole.generatedText(), text);
		assertEquals(FakePredictor.answerFor("Tell me a story"), text);
	}

	@Test
	public void testStreamFailureTruncates() {
		deploy(config());
		predictor.failStreamAfter(1);
		TokenStream stream = deployment.call("{\"text\": \"a b c\", \"stream\": true}").getStream();
		assertEquals("Echo", stream.next().text());
		try {
			while (stream.hasNext()) {
				stream.next();
			}
			fail("Expected BackendGenerationException");
		} catch (BackendGenerationException e) {
			LOGGER.log(System.Logger.Level.DEBUG, "Stream truncated as expected: " + e.getMessage());
		}
	}

	@Test
	public void testBackendFailureIs500() {
		PredictorResponse response = deploy(config(), "boom").call("{\"text\": \"boom\"}");
		assertEquals(500, response.getStatus());
		assertTrue(((String) response.getBody()).contains("backend exploded"));
	}

	@Test
	public void testUnknownChatProcessorRefusesToStart() {
		InferenceConfig config = config().setModelDescription(new ModelDescription().setChatProcessor("ChatModelNope"));
		try {
			deploy(config);
			fail("Expected ChatProcessorNotFoundException");
		} catch (ChatProcessorNotFoundException e) {
			assertEquals("demo deployment failed. chat_processor(ChatModelNope) does not exist.", e.getMessage());
		}
	}

	@Test
	@SuppressWarnings("unchecked")
	public void testChatProcessorKeepsArrayShape() {
		InferenceConfig config = config().setModelDescription(new ModelDescription()
			.setChatProcessor("ChatModelGptJ")
			.setPrompt(new PromptConfig().setHumanId("User").setBotId("Bot")));
		PredictorResponse response = deploy(config).call("{\"text\": [{\"role\": \"user\", \"content\": \"Hi\"}]}");

		List<ResponseEnvelope> envelopes = (List<ResponseEnvelope>) response.getBody();
		assertEquals(1, envelopes.size());
		assertEquals(List.of("User: Hi\nBot:"), predictor.getCalls().get(0).prompts());
	}

	@Test
	@SuppressWarnings("unchecked")
	public void testContinuousBackend() {
		deploy(config().setVllm(new VllmConfig().setEnabled(true)));
		assertEquals(BackendKind.CONTINUOUS_BATCH, deployment.getKind());

		List<ResponseEnvelope> envelopes = (List<ResponseEnvelope>) deployment.call("{\"text\": \"Hello\"}").getBody();
		assertEquals("Echo Hello", envelopes.get(0).generatedText());

		String streamed = drain(deployment.call("{\"text\": \"Hello there\", \"stream\": true}").getStream());
		assertEquals("Echo Hello there", streamed);
		assertEquals(2, predictor.getAsyncCalls());
	}

	@Test
	public void testMultimodalRequestCarriesImages() {
		InferenceConfig config = config().setModelDescription(new ModelDescription()
			.setChatProcessor("ChatModelwithImage")
			.setPrompt(new PromptConfig().setHumanId("USER").setBotId("ASSISTANT")));
		deploy(config);
		assertEquals(BackendKind.MULTIMODAL, deployment.getKind());

		PredictorResponse response = deployment.call("{\"text\": [{\"role\": \"user\", \"content\": ["
			+ "{\"type\": \"text\", \"text\": \"What is this?\"},"
			+ "{\"type\": \"image_url\", \"image_url\": {\"url\": \"https://example.com/cat.png\"}}]}]}");
		assertEquals(200, response.getStatus());
		assertEquals(List.of("https://example.com/cat.png"), predictor.getCalls().get(0).images());
	}

	@Test
	public void testResolveKind() {
		assertEquals(BackendKind.SINGLE_PROCESS, PredictorDeployment.resolveKind(config()));
		assertEquals(BackendKind.SHARDED, PredictorDeployment.resolveKind(config().setDeepspeed(true)));
		assertEquals(BackendKind.CONTINUOUS_BATCH,
			PredictorDeployment.resolveKind(config().setVllm(new VllmConfig().setEnabled(true))));
	}

	@Test
	public void testOpenaiCall() throws Exception {
		deploy(config());
		EnvelopeStream single = deployment.openaiCall(MAPPER.readTree("\"Hello\""), Map.of(), false);
		ResponseEnvelope envelope = single.next();
		assertEquals("Echo Hello", envelope.generatedText());
		assertFalse(single.hasNext());

		List<String> tokens = new ArrayList<>();
		try (EnvelopeStream streamed = deployment.openaiCall(MAPPER.readTree("\"a b\""), Map.of(), true)) {
			while (streamed.hasNext()) {
				ResponseEnvelope token = streamed.next();
				assertEquals(1, token.numGeneratedTokens());
				tokens.add(token.generatedText());
			}
		}
		assertEquals(List.of("Echo", " a", " b"), tokens);

		try {
			deployment.openaiCall(MAPPER.readTree("[\"p1\", \"p2\"]"), Map.of(), false);
			fail("Expected InvalidRequestException");
		} catch (InvalidRequestException e) {
			assertEquals(ErrorKind.MULTIPLE_PROMPTS_UNSUPPORTED, e.getKind());
		}
	}

	@Test
	public void testStreamedInputLengthIsPerRequest() throws Exception {
		deployment = new PredictorDeployment(config(), (kind, cfg) -> {
			predictor = new FakePredictor(kind).withBackendInputLength(99);
			return predictor;
		});
		try (EnvelopeStream streamed = deployment.openaiCall(MAPPER.readTree("\"a b\""), Map.of(), true)) {
			while (streamed.hasNext()) {
				ResponseEnvelope token = streamed.next();
				assertEquals(3, token.numInputTokens());
				assertEquals(3, token.numInputTokensBatch());
			}
		}
	}

	@Test
	public void testStreamedInputLengthFallsBackToBackend() throws Exception {
		deployment = new PredictorDeployment(config(), (kind, cfg) -> {
			predictor = new FakePredictor(kind).withBackendInputLength(42).withoutStreamInputLength();
			return predictor;
		});
		int envelopes = 0;
		try (EnvelopeStream streamed = deployment.openaiCall(MAPPER.readTree("\"a b\""), Map.of(), true)) {
			while (streamed.hasNext()) {
				assertEquals(42, streamed.next().numInputTokens());
				envelopes++;
			}
		}
		assertEquals(3, envelopes);
	}

	@Test
	public void testCloseReleasesBackend() {
		deploy(config());
		deployment.close();
		assertTrue(predictor.isClosed());
		deployment = null;
	}
}

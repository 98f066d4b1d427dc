package de.kherud.serve.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Deployment configuration, bound from snake_case JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InferenceConfig {

	private static final ObjectMapper MAPPER = new ObjectMapper()
		.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

	@JsonProperty("name")
	private String name = "default";
	@JsonProperty("route_prefix")
	private String routePrefix = "";
	@JsonProperty("port")
	private int port = 8000;
	@JsonProperty("device")
	private String device = "cpu";
	@JsonProperty("deepspeed")
	private boolean deepspeed = false;
	@JsonProperty("vllm")
	private VllmConfig vllm = new VllmConfig();
	@JsonProperty("max_batch_size")
	private int maxBatchSize = 4;
	@JsonProperty("batch_wait_timeout_ms")
	private long batchWaitTimeoutMs = 10;
	@JsonProperty("stream_poll_interval_ms")
	private long streamPollIntervalMs = 1;
	@JsonProperty("model_description")
	private ModelDescription modelDescription = new ModelDescription();
	@JsonProperty("backend")
	private BackendConfig backend = new BackendConfig();

	public static InferenceConfig load(Path path) throws IOException {
		try (InputStream in = Files.newInputStream(path)) {
			return MAPPER.readValue(in, InferenceConfig.class);
		}
	}

	public static InferenceConfig fromResource(String resource) throws IOException {
		try (InputStream in = InferenceConfig.class.getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				throw new IOException("Configuration resource not found: " + resource);
			}
			return MAPPER.readValue(in, InferenceConfig.class);
		}
	}

	public static InferenceConfig fromJson(String json) throws IOException {
		return MAPPER.readValue(json, InferenceConfig.class);
	}

	public String getName() { return name; }
	public String getRoutePrefix() { return routePrefix; }
	public int getPort() { return port; }
	public String getDevice() { return device; }
	public boolean isDeepspeed() { return deepspeed; }
	public VllmConfig getVllm() { return vllm; }
	public int getMaxBatchSize() { return maxBatchSize; }
	public long getBatchWaitTimeoutMs() { return batchWaitTimeoutMs; }
	public long getStreamPollIntervalMs() { return streamPollIntervalMs; }
	public ModelDescription getModelDescription() { return modelDescription; }
	public BackendConfig getBackend() { return backend; }

	public Duration getBatchWaitTimeout() {
		return Duration.ofMillis(batchWaitTimeoutMs);
	}

	public Duration getStreamPollInterval() {
		return Duration.ofMillis(streamPollIntervalMs);
	}

	public InferenceConfig setName(String name) { this.name = name; return this; }
	public InferenceConfig setRoutePrefix(String routePrefix) { this.routePrefix = routePrefix; return this; }
	public InferenceConfig setPort(int port) { this.port = port; return this; }
	public InferenceConfig setDevice(String device) { this.device = device; return this; }
	public InferenceConfig setDeepspeed(boolean deepspeed) { this.deepspeed = deepspeed; return this; }
	public InferenceConfig setVllm(VllmConfig vllm) { this.vllm = vllm; return this; }
	public InferenceConfig setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; return this; }
	public InferenceConfig setBatchWaitTimeoutMs(long ms) { this.batchWaitTimeoutMs = ms; return this; }
	public InferenceConfig setStreamPollIntervalMs(long ms) { this.streamPollIntervalMs = ms; return this; }
	public InferenceConfig setModelDescription(ModelDescription modelDescription) { this.modelDescription = modelDescription; return this; }
	public InferenceConfig setBackend(BackendConfig backend) { this.backend = backend; return this; }

	/**
	 * Applies {@code serve.port} and {@code serve.max_batch_size} system properties on top of the file values.
	 */
	public InferenceConfig applySystemOverrides() {
		String portOverride = System.getProperty("serve.port");
		if (portOverride != null) {
			this.port = Integer.parseInt(portOverride);
		}
		String batchOverride = System.getProperty("serve.max_batch_size");
		if (batchOverride != null) {
			this.maxBatchSize = Integer.parseInt(batchOverride);
		}
		return this;
	}
}

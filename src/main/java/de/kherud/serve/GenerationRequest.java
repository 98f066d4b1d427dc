package de.kherud.serve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import de.kherud.serve.error.ErrorKind;
import de.kherud.serve.error.InvalidRequestException;

import java.util.Collections;
import java.util.Map;

/**
 * Body of a generation call: {@code {"text": string | array, "stream": bool, "config": object}}.
 */
public final class GenerationRequest {

	private static final ObjectMapper MAPPER = new ObjectMapper();
	private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {
	};

	private final JsonNode text;
	private final boolean stream;
	private final Map<String, Object> config;

	public GenerationRequest(JsonNode text, boolean stream, Map<String, Object> config) {
		this.text = text == null ? MissingNode.getInstance() : text;
		this.stream = stream;
		this.config = config == null ? Collections.emptyMap() : Collections.unmodifiableMap(config);
	}

	/**
	 * @throws InvalidRequestException with {@link ErrorKind#INVALID_JSON} if the body is not a JSON object
	 */
	public static GenerationRequest parse(String body) {
		JsonNode root;
		try {
			root = MAPPER.readTree(body);
		} catch (JsonProcessingException e) {
			throw new InvalidRequestException(ErrorKind.INVALID_JSON, e);
		}
		if (root == null || !root.isObject()) {
			throw new InvalidRequestException(ErrorKind.INVALID_JSON);
		}
		JsonNode configNode = root.path("config");
		Map<String, Object> config = Collections.emptyMap();
		if (configNode.isObject()) {
			config = MAPPER.convertValue(configNode, CONFIG_TYPE);
		} else if (!configNode.isMissingNode() && !configNode.isNull()) {
			throw new InvalidRequestException(ErrorKind.INVALID_JSON);
		}
		return new GenerationRequest(root.path("text"), root.path("stream").asBoolean(false), config);
	}

	public JsonNode getText() {
		return text;
	}

	public boolean isStream() {
		return stream;
	}

	public Map<String, Object> getConfig() {
		return config;
	}

	/**
	 * {@code true} for a missing, null or empty {@code text}.
	 */
	public boolean isTextEmpty() {
		if (text.isMissingNode() || text.isNull()) {
			return true;
		}
		if (text.isTextual()) {
			return text.asText().isEmpty();
		}
		return text.isArray() && text.isEmpty();
	}
}

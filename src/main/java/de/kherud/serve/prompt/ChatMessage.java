package de.kherud.serve.prompt;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One chat turn. {@code content} is the text of the turn; images referenced by the turn (URLs or base64 data)
 * are kept aside in {@code images}.
 */
public record ChatMessage(String role, String content, List<String> images) {

	public ChatMessage(String role, String content) {
		this(role, content, Collections.emptyList());
	}

	public ChatMessage {
		images = images != null ? List.copyOf(images) : Collections.emptyList();
	}

	/**
	 * Parses a chat turn of the form {@code {"role": ..., "content": ...}} where content is either a string or a
	 * list of {@code text} / {@code image_url} parts.
	 *
	 * @throws IllegalArgumentException if the node is not a recognisable chat turn
	 */
	public static ChatMessage fromJson(JsonNode node) {
		if (node == null || !node.isObject()) {
			throw new IllegalArgumentException("Chat message must be an object");
		}
		JsonNode role = node.get("role");
		JsonNode content = node.get("content");
		if (role == null || !role.isTextual() || content == null) {
			throw new IllegalArgumentException("Chat message needs a textual role and a content");
		}
		if (content.isTextual()) {
			return new ChatMessage(role.asText(), content.asText());
		}
		if (!content.isArray()) {
			throw new IllegalArgumentException("Unsupported chat message content: " + content.getNodeType());
		}
		StringBuilder text = new StringBuilder();
		List<String> images = new ArrayList<>();
		for (JsonNode part : content) {
			String type = part.path("type").asText("");
			switch (type) {
				case "text":
					text.append(part.path("text").asText(""));
					break;
				case "image_url":
					JsonNode imageUrl = part.path("image_url");
					images.add(imageUrl.isObject() ? imageUrl.path("url").asText() : imageUrl.asText());
					break;
				default:
					throw new IllegalArgumentException("Unsupported content part type: " + type);
			}
		}
		return new ChatMessage(role.asText(), text.toString(), images);
	}
}

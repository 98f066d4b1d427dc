package de.kherud.serve.prompt;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Shape of a list-valued {@code text} field.
 */
public enum PromptFormat {
	/** Every element is a chat turn object. */
	CHAT_FORMAT,
	/** Every element is an already flat prompt string. */
	PROMPTS_FORMAT,
	/** Mixed or unrecognisable elements. */
	INVALID_FORMAT;

	public static PromptFormat of(JsonNode items) {
		if (items == null || !items.isArray()) {
			return INVALID_FORMAT;
		}
		boolean chat = true;
		boolean prompts = true;
		for (JsonNode item : items) {
			if (item.isTextual()) {
				chat = false;
			} else if (item.isObject()) {
				prompts = false;
			} else {
				return INVALID_FORMAT;
			}
		}
		if (chat) {
			return CHAT_FORMAT;
		}
		return prompts ? PROMPTS_FORMAT : INVALID_FORMAT;
	}
}

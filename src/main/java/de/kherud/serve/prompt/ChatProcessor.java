package de.kherud.serve.prompt;

import java.util.List;

/**
 * Formats a conversation into the single prompt string a model expects.
 */
@FunctionalInterface
public interface ChatProcessor {

	String getPrompt(List<ChatMessage> messages);
}

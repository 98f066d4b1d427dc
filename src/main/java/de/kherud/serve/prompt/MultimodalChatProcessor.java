package de.kherud.serve.prompt;

import java.util.List;

/**
 * Chat processor that also collects the images a conversation refers to.
 */
public interface MultimodalChatProcessor extends ChatProcessor {

	FormattedPrompt format(List<ChatMessage> messages);

	@Override
	default String getPrompt(List<ChatMessage> messages) {
		return format(messages).prompt();
	}
}

package de.kherud.serve.prompt;

import de.kherud.serve.config.PromptConfig;

import java.util.List;

/**
 * Frames a conversation with the configured intro and speaker tags, ending with the bot tag so the model
 * continues as the assistant.
 */
public class ConversationChatProcessor implements ChatProcessor {

	/**
	 * How a speaker tag is joined to the turn's content.
	 */
	public enum Style {
		/** {@code "<human_id>: content"} */
		COLON(": ", ":"),
		/** {@code "<human_id> content"} */
		SPACE(" ", ""),
		/** {@code "<human_id>content"} */
		ADJACENT("", "");

		private final String separator;
		private final String generationSuffix;

		Style(String separator, String generationSuffix) {
			this.separator = separator;
			this.generationSuffix = generationSuffix;
		}
	}

	private final PromptConfig prompt;
	private final Style style;

	public ConversationChatProcessor(PromptConfig prompt, Style style) {
		this.prompt = prompt;
		this.style = style;
	}

	@Override
	public String getPrompt(List<ChatMessage> messages) {
		StringBuilder formatted = new StringBuilder(prompt.getIntro());
		for (ChatMessage message : messages) {
			switch (message.role().toLowerCase()) {
				case "user":
					appendTurn(formatted, prompt.getHumanId(), message.content());
					break;
				case "assistant":
					appendTurn(formatted, prompt.getBotId(), message.content());
					break;
				default:
					formatted.append(message.content()).append('\n');
					break;
			}
		}
		formatted.append(prompt.getBotId()).append(style.generationSuffix);
		return formatted.toString();
	}

	private void appendTurn(StringBuilder formatted, String speaker, String content) {
		formatted.append(speaker).append(style.separator).append(content).append('\n');
	}
}

package de.kherud.serve.prompt;

import de.kherud.serve.config.PromptConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversation framing for multimodal models. Every image of a user turn is replaced by an
 * {@value #IMAGE_TOKEN} marker in front of the turn's text and returned separately, in order.
 */
public class ImageChatProcessor implements MultimodalChatProcessor {

	public static final String IMAGE_TOKEN = "<image>";

	private final PromptConfig prompt;

	public ImageChatProcessor(PromptConfig prompt) {
		this.prompt = prompt;
	}

	@Override
	public FormattedPrompt format(List<ChatMessage> messages) {
		StringBuilder formatted = new StringBuilder(prompt.getIntro());
		List<String> images = new ArrayList<>();
		for (ChatMessage message : messages) {
			String role = message.role().toLowerCase();
			if ("assistant".equals(role)) {
				formatted.append(prompt.getBotId()).append(": ").append(message.content()).append('\n');
				continue;
			}
			if ("user".equals(role)) {
				formatted.append(prompt.getHumanId()).append(": ");
			}
			for (String image : message.images()) {
				formatted.append(IMAGE_TOKEN).append('\n');
				images.add(image);
			}
			formatted.append(message.content()).append('\n');
		}
		formatted.append(prompt.getBotId()).append(':');
		return new FormattedPrompt(formatted.toString(), images);
	}
}

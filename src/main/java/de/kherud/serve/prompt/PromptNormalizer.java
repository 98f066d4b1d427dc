package de.kherud.serve.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import de.kherud.serve.error.ErrorKind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a request's raw {@code text} field into the prompt shape the backend needs.
 * <p>
 * A string stays a single prompt (or a one-element sequence when a sequence is requested). A list of flat prompt
 * strings passes through unchanged. A list of chat turns is formatted into one prompt by the chat processor when
 * one is configured; without a processor the turns' contents pass through as a sequence. Shape errors are
 * returned as an invalid {@link PromptResult}, never thrown.
 */
public class PromptNormalizer {

	private final ChatProcessor processor;

	public PromptNormalizer(@Nullable ChatProcessor processor) {
		this.processor = processor;
	}

	public boolean hasProcessor() {
		return processor != null;
	}

	public PromptResult normalize(String requestId, JsonNode text, boolean returnAsSequence) {
		if (text == null || text.isNull() || text.isMissingNode()) {
			return PromptResult.invalid(ErrorKind.EMPTY_PROMPT);
		}
		if (text.isTextual()) {
			if (text.asText().isEmpty()) {
				return PromptResult.invalid(ErrorKind.EMPTY_PROMPT);
			}
			return PromptResult.ok(returnAsSequence
				? NormalizedPrompt.sequence(requestId, List.of(text.asText()))
				: NormalizedPrompt.single(requestId, text.asText()));
		}
		if (!text.isArray()) {
			return PromptResult.invalid(ErrorKind.INVALID_PROMPT_FORMAT);
		}
		if (text.isEmpty()) {
			return PromptResult.invalid(ErrorKind.EMPTY_PROMPT);
		}
		switch (PromptFormat.of(text)) {
			case CHAT_FORMAT:
				return normalizeChat(requestId, text, returnAsSequence);
			case PROMPTS_FORMAT:
				List<String> prompts = new ArrayList<>(text.size());
				text.forEach(item -> prompts.add(item.asText()));
				return PromptResult.ok(NormalizedPrompt.sequence(requestId, prompts));
			default:
				return PromptResult.invalid(ErrorKind.INVALID_PROMPT_FORMAT);
		}
	}

	/**
	 * Normalization for the OpenAI-compatible path: a single conversation or a single prompt only.
	 * The result is always a one-element sequence.
	 */
	public PromptResult normalizeConversation(String requestId, JsonNode prompt) {
		if (prompt != null && prompt.isArray() && PromptFormat.of(prompt) == PromptFormat.PROMPTS_FORMAT) {
			return PromptResult.invalid(ErrorKind.MULTIPLE_PROMPTS_UNSUPPORTED);
		}
		return normalize(requestId, prompt, true);
	}

	private PromptResult normalizeChat(String requestId, JsonNode text, boolean returnAsSequence) {
		List<ChatMessage> messages = new ArrayList<>(text.size());
		try {
			text.forEach(item -> messages.add(ChatMessage.fromJson(item)));
		} catch (IllegalArgumentException e) {
			return PromptResult.invalid(ErrorKind.INVALID_PROMPT_FORMAT);
		}
		if (processor == null) {
			List<String> contents = new ArrayList<>(messages.size());
			List<String> images = new ArrayList<>();
			for (ChatMessage message : messages) {
				contents.add(message.content());
				images.addAll(message.images());
			}
			return PromptResult.ok(NormalizedPrompt.sequence(requestId, contents).withImages(images));
		}
		String formatted;
		List<String> images = List.of();
		if (processor instanceof MultimodalChatProcessor) {
			FormattedPrompt withImages = ((MultimodalChatProcessor) processor).format(messages);
			formatted = withImages.prompt();
			images = withImages.images();
		} else {
			formatted = processor.getPrompt(messages);
		}
		NormalizedPrompt normalized = returnAsSequence
			? NormalizedPrompt.sequence(requestId, List.of(formatted))
			: NormalizedPrompt.single(requestId, formatted);
		return PromptResult.ok(normalized.withImages(images));
	}
}

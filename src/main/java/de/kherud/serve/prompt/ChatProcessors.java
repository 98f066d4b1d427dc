package de.kherud.serve.prompt;

import de.kherud.serve.config.ModelDescription;
import de.kherud.serve.error.ChatProcessorNotFoundException;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.function.Function;

/**
 * Resolves a chat processor by the name given in {@code model_description.chat_processor}.
 */
public final class ChatProcessors {

	/** Processor name that marks a deployment as multimodal. */
	public static final String IMAGE_PROCESSOR = "ChatModelwithImage";
	/** Picks a template processor from the model id. */
	public static final String AUTO_TEMPLATE = "auto";

	private static final Map<String, Function<ModelDescription, ChatProcessor>> NAMED = Map.of(
		"ChatModelGptJ", description -> new ConversationChatProcessor(description.getPrompt(), ConversationChatProcessor.Style.COLON),
		"ChatModelLLama", description -> new ConversationChatProcessor(description.getPrompt(), ConversationChatProcessor.Style.SPACE),
		"ChatModelGemma", description -> new ConversationChatProcessor(description.getPrompt(), ConversationChatProcessor.Style.ADJACENT),
		"ChatModelNoFormat", description -> messages -> {
			StringBuilder prompt = new StringBuilder();
			messages.forEach(message -> prompt.append(message.content()));
			return prompt.toString();
		},
		IMAGE_PROCESSOR, description -> new ImageChatProcessor(description.getPrompt()),
		AUTO_TEMPLATE, description -> new TemplateChatProcessor(TemplateChatProcessor.detectTemplate(description.getModelIdOrPath()))
	);

	private ChatProcessors() {
	}

	/**
	 * @return the processor configured for {@code description}, or {@code null} when none is configured
	 * @throws ChatProcessorNotFoundException if a processor is configured but unknown
	 */
	@Nullable
	public static ChatProcessor create(String deploymentName, ModelDescription description) {
		String name = description.getChatProcessor();
		if (name == null || name.isEmpty()) {
			return null;
		}
		Function<ModelDescription, ChatProcessor> factory = NAMED.get(name);
		if (factory != null) {
			return factory.apply(description);
		}
		TemplateChatProcessor.TemplateType template = TemplateChatProcessor.TemplateType.fromName(name);
		if (template != null) {
			return new TemplateChatProcessor(template);
		}
		throw new ChatProcessorNotFoundException(deploymentName, name);
	}

	public static boolean isMultimodal(@Nullable String processorName) {
		return IMAGE_PROCESSOR.equals(processorName);
	}
}

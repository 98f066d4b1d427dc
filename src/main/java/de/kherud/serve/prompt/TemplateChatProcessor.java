package de.kherud.serve.prompt;

import java.util.List;
import java.util.Map;

/**
 * Formats a conversation with the special-token template of a model family (Llama 3, ChatML, ...).
 */
public class TemplateChatProcessor implements ChatProcessor {

	public enum TemplateType {
		LLAMA3("llama3"),
		CHATML("chatml"),
		ALPACA("alpaca"),
		LLAMA2("llama2"),
		MISTRAL("mistral"),
		ZEPHYR("zephyr"),
		VICUNA("vicuna");

		private final String name;

		TemplateType(String name) {
			this.name = name;
		}

		public String getName() {
			return name;
		}

		public static TemplateType fromName(String name) {
			for (TemplateType type : values()) {
				if (type.name.equalsIgnoreCase(name)) {
					return type;
				}
			}
			return null;
		}
	}

	public static final class Template {
		final String bos;
		final String systemOpen;
		final String systemClose;
		final String userOpen;
		final String userClose;
		final String assistantOpen;
		final String assistantClose;

		Template(String bos, String systemOpen, String systemClose, String userOpen, String userClose,
				 String assistantOpen, String assistantClose) {
			this.bos = bos;
			this.systemOpen = systemOpen;
			this.systemClose = systemClose;
			this.userOpen = userOpen;
			this.userClose = userClose;
			this.assistantOpen = assistantOpen;
			this.assistantClose = assistantClose;
		}
	}

	private static final Map<TemplateType, Template> TEMPLATES = Map.of(
		TemplateType.LLAMA3, new Template("<|begin_of_text|>",
			"<|start_header_id|>system<|end_header_id|>\n\n", "<|eot_id|>",
			"<|start_header_id|>user<|end_header_id|>\n\n", "<|eot_id|>",
			"<|start_header_id|>assistant<|end_header_id|>\n\n", "<|eot_id|>"),
		TemplateType.CHATML, new Template("",
			"<|im_start|>system\n", "<|im_end|>\n",
			"<|im_start|>user\n", "<|im_end|>\n",
			"<|im_start|>assistant\n", "<|im_end|>\n"),
		TemplateType.ALPACA, new Template("",
			"", "\n\n",
			"### Instruction:\n", "\n\n",
			"### Response:\n", "\n\n"),
		TemplateType.LLAMA2, new Template("<s>",
			"[INST] <<SYS>>\n", "\n<</SYS>>\n\n",
			"[INST] ", " [/INST]",
			" ", " </s><s>"),
		TemplateType.MISTRAL, new Template("<s>",
			"", "\n\n",
			"[INST] ", " [/INST]",
			"", "</s>"),
		TemplateType.ZEPHYR, new Template("",
			"<|system|>\n", "</s>\n",
			"<|user|>\n", "</s>\n",
			"<|assistant|>\n", "</s>\n"),
		TemplateType.VICUNA, new Template("",
			"", "\n\n",
			"USER: ", "\n",
			"ASSISTANT: ", "\n")
	);

	private final TemplateType type;
	private final Template template;

	public TemplateChatProcessor(TemplateType type) {
		this.type = type;
		this.template = TEMPLATES.get(type);
	}

	public TemplateType getType() {
		return type;
	}

	@Override
	public String getPrompt(List<ChatMessage> messages) {
		StringBuilder formatted = new StringBuilder(template.bos);
		// Llama 2 folds the system block into the first [INST] section
		boolean pendingLlama2System = false;
		for (ChatMessage message : messages) {
			switch (message.role().toLowerCase()) {
				case "system":
					formatted.append(template.systemOpen).append(message.content()).append(template.systemClose);
					pendingLlama2System = type == TemplateType.LLAMA2;
					break;
				case "assistant":
					formatted.append(template.assistantOpen).append(message.content()).append(template.assistantClose);
					break;
				default:
					if (pendingLlama2System) {
						formatted.append(message.content()).append(template.userClose);
						pendingLlama2System = false;
					} else {
						formatted.append(template.userOpen).append(message.content()).append(template.userClose);
					}
					break;
			}
		}
		if (!messages.isEmpty() && !"assistant".equalsIgnoreCase(messages.get(messages.size() - 1).role())) {
			formatted.append(template.assistantOpen);
		}
		return formatted.toString();
	}

	/**
	 * Guesses the template family from a model id or path.
	 */
	public static TemplateType detectTemplate(String modelName) {
		String lower = modelName == null ? "" : modelName.toLowerCase();
		if (lower.contains("llama-3") || lower.contains("llama3")) {
			return TemplateType.LLAMA3;
		} else if (lower.contains("llama-2") || lower.contains("llama2")) {
			return TemplateType.LLAMA2;
		} else if (lower.contains("mistral") || lower.contains("mixtral")) {
			return TemplateType.MISTRAL;
		} else if (lower.contains("vicuna")) {
			return TemplateType.VICUNA;
		} else if (lower.contains("zephyr")) {
			return TemplateType.ZEPHYR;
		} else if (lower.contains("alpaca")) {
			return TemplateType.ALPACA;
		}
		return TemplateType.CHATML;
	}
}

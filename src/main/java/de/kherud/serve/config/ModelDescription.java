package de.kherud.serve.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelDescription {

	@JsonProperty("model_id_or_path")
	private String modelIdOrPath;
	@JsonProperty("chat_processor")
	private String chatProcessor;
	@JsonProperty("prompt")
	private PromptConfig prompt = new PromptConfig();

	public String getModelIdOrPath() { return modelIdOrPath; }

	@Nullable
	public String getChatProcessor() { return chatProcessor; }

	public PromptConfig getPrompt() { return prompt; }

	public ModelDescription setModelIdOrPath(String modelIdOrPath) { this.modelIdOrPath = modelIdOrPath; return this; }
	public ModelDescription setChatProcessor(String chatProcessor) { this.chatProcessor = chatProcessor; return this; }
	public ModelDescription setPrompt(PromptConfig prompt) { this.prompt = prompt; return this; }
}

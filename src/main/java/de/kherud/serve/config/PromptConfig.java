package de.kherud.serve.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversation framing used by the chat processors.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptConfig {

	@JsonProperty("intro")
	private String intro = "";
	@JsonProperty("human_id")
	private String humanId = "";
	@JsonProperty("bot_id")
	private String botId = "";
	@JsonProperty("stop_words")
	private List<String> stopWords = new ArrayList<>();

	public String getIntro() { return intro; }
	public String getHumanId() { return humanId; }
	public String getBotId() { return botId; }
	public List<String> getStopWords() { return stopWords; }

	public PromptConfig setIntro(String intro) { this.intro = intro; return this; }
	public PromptConfig setHumanId(String humanId) { this.humanId = humanId; return this; }
	public PromptConfig setBotId(String botId) { this.botId = botId; return this; }
	public PromptConfig setStopWords(List<String> stopWords) { this.stopWords = new ArrayList<>(stopWords); return this; }
}

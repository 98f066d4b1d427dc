package de.kherud.serve.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Where the remote generation server lives.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BackendConfig {

	@JsonProperty("url")
	private String url = "http://127.0.0.1:8080";
	@JsonProperty("timeout_seconds")
	private long timeoutSeconds = 300;

	public String getUrl() { return url; }
	public long getTimeoutSeconds() { return timeoutSeconds; }

	public Duration getTimeout() {
		return Duration.ofSeconds(timeoutSeconds);
	}

	public BackendConfig setUrl(String url) { this.url = url; return this; }
	public BackendConfig setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; return this; }
}

package de.kherud.serve.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Switches the deployment to a continuous-batching backend.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VllmConfig {

	@JsonProperty("enabled")
	private boolean enabled = false;

	public boolean isEnabled() { return enabled; }

	public VllmConfig setEnabled(boolean enabled) { this.enabled = enabled; return this; }
}

package de.kherud.serve.prompt;

import java.util.List;

public record FormattedPrompt(String prompt, List<String> images) {

	public FormattedPrompt {
		images = List.copyOf(images);
	}
}

package de.kherud.serve.prompt;

import java.util.Collections;
import java.util.List;

/**
 * The prompt shape handed to the batch router: either one prompt string or an ordered sequence of them.
 * Element order is preserved end-to-end, and the shape decides whether the response is a single
 * object or an array.
 */
public final class NormalizedPrompt {

	private final String requestId;
	private final List<String> prompts;
	private final List<String> images;
	private final boolean sequence;

	private NormalizedPrompt(String requestId, List<String> prompts, List<String> images, boolean sequence) {
		this.requestId = requestId;
		this.prompts = List.copyOf(prompts);
		this.images = List.copyOf(images);
		this.sequence = sequence;
	}

	public static NormalizedPrompt single(String requestId, String prompt) {
		return new NormalizedPrompt(requestId, List.of(prompt), Collections.emptyList(), false);
	}

	public static NormalizedPrompt sequence(String requestId, List<String> prompts) {
		return new NormalizedPrompt(requestId, prompts, Collections.emptyList(), true);
	}

	public NormalizedPrompt withImages(List<String> images) {
		return new NormalizedPrompt(requestId, prompts, images, sequence);
	}

	public String getRequestId() {
		return requestId;
	}

	public List<String> getPrompts() {
		return prompts;
	}

	/**
	 * The first (for a single prompt, the only) prompt.
	 */
	public String getPrompt() {
		return prompts.get(0);
	}

	public List<String> getImages() {
		return images;
	}

	public boolean hasImages() {
		return !images.isEmpty();
	}

	public boolean isSequence() {
		return sequence;
	}

	public int size() {
		return prompts.size();
	}

	@Override
	public String toString() {
		return "NormalizedPrompt{requestId=" + requestId + ", prompts=" + prompts.size()
			+ ", images=" + images.size() + ", sequence=" + sequence + '}';
	}
}

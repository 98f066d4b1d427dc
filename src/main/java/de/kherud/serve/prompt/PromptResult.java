package de.kherud.serve.prompt;

import de.kherud.serve.error.ErrorKind;
import de.kherud.serve.error.InvalidRequestException;

import java.util.Objects;

/**
 * Outcome of prompt normalization: a {@link NormalizedPrompt} or the request-shape error that prevented one.
 */
public final class PromptResult {

	private final NormalizedPrompt prompt;
	private final ErrorKind error;

	private PromptResult(NormalizedPrompt prompt, ErrorKind error) {
		this.prompt = prompt;
		this.error = error;
	}

	public static PromptResult ok(NormalizedPrompt prompt) {
		return new PromptResult(Objects.requireNonNull(prompt), null);
	}

	public static PromptResult invalid(ErrorKind error) {
		return new PromptResult(null, Objects.requireNonNull(error));
	}

	public boolean isValid() {
		return prompt != null;
	}

	public NormalizedPrompt get() {
		if (prompt == null) {
			throw new InvalidRequestException(error);
		}
		return prompt;
	}

	public ErrorKind getError() {
		return error;
	}
}

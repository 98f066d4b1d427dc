package de.kherud.serve.batch;

import de.kherud.serve.backend.GenerationResult;
import de.kherud.serve.error.BackendGenerationException;

import java.util.Objects;

/**
 * Per-caller result of a dynamic batch: the caller's generation result, or an explicit failure marker when the
 * backend call of the caller's group failed.
 */
public final class BatchOutcome {

	private final GenerationResult result;
	private final BackendGenerationException failure;

	private BatchOutcome(GenerationResult result, BackendGenerationException failure) {
		this.result = result;
		this.failure = failure;
	}

	public static BatchOutcome success(GenerationResult result) {
		return new BatchOutcome(Objects.requireNonNull(result), null);
	}

	public static BatchOutcome failure(BackendGenerationException failure) {
		return new BatchOutcome(null, Objects.requireNonNull(failure));
	}

	public boolean isSuccess() {
		return failure == null;
	}

	public GenerationResult getResult() {
		return result;
	}

	public BackendGenerationException getFailure() {
		return failure;
	}

	/**
	 * @throws BackendGenerationException if this outcome is a failure
	 */
	public GenerationResult getOrThrow() {
		if (failure != null) {
			throw failure;
		}
		return result;
	}

	@Override
	public String toString() {
		return isSuccess() ? "BatchOutcome{success=" + result + '}' : "BatchOutcome{failure=" + failure.getMessage() + '}';
	}
}

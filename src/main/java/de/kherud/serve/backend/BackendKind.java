package de.kherud.serve.backend;

/**
 * The closed set of generation backends a deployment can drive. Chosen once at startup.
 */
public enum BackendKind {
	/** Model sharded across several devices, driven synchronously. */
	SHARDED,
	/** Engine with its own continuous batching and an asynchronous API. */
	CONTINUOUS_BATCH,
	/** Plain model runner in a single process. */
	SINGLE_PROCESS,
	/** Single-process runner that also accepts images. */
	MULTIMODAL;

	public boolean batchesContinuously() {
		return this == CONTINUOUS_BATCH;
	}
}

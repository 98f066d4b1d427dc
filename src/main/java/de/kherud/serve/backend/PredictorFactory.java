package de.kherud.serve.backend;

import de.kherud.serve.config.InferenceConfig;

/**
 * Builds the backend adapter for the kind a deployment resolved from its configuration.
 */
@FunctionalInterface
public interface PredictorFactory {

	Predictor create(BackendKind kind, InferenceConfig config);
}

package de.kherud.serve;

import de.kherud.serve.backend.PredictorFactory;
import de.kherud.serve.backend.remote.LlamaServerPredictor;
import de.kherud.serve.config.InferenceConfig;
import de.kherud.serve.http.PredictorHttpServer;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Starts one deployment backed by a llama.cpp server and serves it over HTTP until the JVM is stopped.
 * <p>
 * Usage: {@code PredictorMain <config.json>}. The {@code serve.port} and {@code serve.max_batch_size} system
 * properties override the file.
 */
public final class PredictorMain {

	private static final System.Logger LOGGER = System.getLogger(PredictorMain.class.getName());

	private PredictorMain() {
	}

	public static void main(String[] args) throws Exception {
		if (args.length < 1) {
			System.err.println("Usage: PredictorMain <config.json>");
			System.exit(1);
		}
		InferenceConfig config = InferenceConfig.load(Path.of(args[0])).applySystemOverrides();
		PredictorFactory factory = (kind, cfg) -> new LlamaServerPredictor(kind, cfg.getBackend(),
			cfg.getModelDescription().getPrompt().getStopWords());

		PredictorDeployment deployment = new PredictorDeployment(config, factory);
		PredictorHttpServer server = new PredictorHttpServer(deployment, config.getRoutePrefix(), config.getPort()).start();

		CountDownLatch stopped = new CountDownLatch(1);
		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			LOGGER.log(System.Logger.Level.INFO, "Shutting down " + config.getName());
			server.close();
			deployment.close();
			stopped.countDown();
		}, "predictor-shutdown"));
		stopped.await();
	}
}

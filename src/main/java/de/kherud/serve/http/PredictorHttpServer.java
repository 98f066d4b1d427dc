package de.kherud.serve.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import de.kherud.serve.PredictorDeployment;
import de.kherud.serve.PredictorResponse;
import de.kherud.serve.error.BackendGenerationException;
import de.kherud.serve.stream.TokenStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exposes a {@link PredictorDeployment} at {@code POST /<route_prefix>}.
 * <p>
 * Non-streaming responses are written as JSON with the deployment's status. Streaming responses are sent as chunked
 * {@code text/plain} with one write per token. A backend failure after the 200 status went out drops the connection
 * before the terminating chunk, so the client sees an incomplete body rather than a finished one.
 * A client that disconnects mid-stream closes the token stream.
 */
public class PredictorHttpServer implements AutoCloseable {

	private static final System.Logger LOGGER = System.getLogger(PredictorHttpServer.class.getName());
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final PredictorDeployment deployment;
	private final HttpServer server;
	private final ExecutorService executor;
	private final String path;

	public PredictorHttpServer(PredictorDeployment deployment, String routePrefix, int port) throws IOException {
		this.deployment = deployment;
		this.path = normalizePath(routePrefix);
		this.server = HttpServer.create(new InetSocketAddress(port), 0);
		AtomicInteger counter = new AtomicInteger(0);
		this.executor = Executors.newCachedThreadPool(r -> {
			Thread t = new Thread(r);
			t.setName("predictor-http-" + counter.getAndIncrement());
			t.setDaemon(true);
			return t;
		});
		this.server.setExecutor(executor);
		this.server.createContext(path, this::handle);
	}

	private static String normalizePath(String routePrefix) {
		if (routePrefix == null || routePrefix.isEmpty() || "/".equals(routePrefix)) {
			return "/";
		}
		return routePrefix.startsWith("/") ? routePrefix : "/" + routePrefix;
	}

	public PredictorHttpServer start() {
		server.start();
		LOGGER.log(System.Logger.Level.INFO, "Serving " + deployment.getConfig().getName() + " at http://"
			+ server.getAddress().getHostString() + ":" + getPort() + path);
		return this;
	}

	public int getPort() {
		return server.getAddress().getPort();
	}

	public String getPath() {
		return path;
	}

	private void handle(HttpExchange exchange) throws IOException {
		boolean truncated = false;
		try {
			if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
				exchange.getResponseHeaders().set("Allow", "POST");
				exchange.sendResponseHeaders(405, -1);
				return;
			}
			String body;
			try (InputStream in = exchange.getRequestBody()) {
				body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
			}
			PredictorResponse response = deployment.call(body);
			if (response.isStreaming()) {
				writeStream(exchange, response.getStream());
			} else {
				writeJson(exchange, response);
			}
		} catch (TruncatedStreamException e) {
			truncated = true;
			throw e;
		} finally {
			// closing the exchange would write the final chunk; the server drops the connection instead
			if (!truncated) {
				exchange.close();
			}
		}
	}

	private static void writeJson(HttpExchange exchange, PredictorResponse response) throws IOException {
		byte[] bytes = MAPPER.writeValueAsBytes(response.getBody());
		exchange.getResponseHeaders().set("Content-Type", PredictorResponse.JSON);
		exchange.sendResponseHeaders(response.getStatus(), bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}

	private static void writeStream(HttpExchange exchange, TokenStream tokens) throws IOException {
		try (tokens) {
			exchange.getResponseHeaders().set("Content-Type", PredictorResponse.TEXT + "; charset=utf-8");
			exchange.sendResponseHeaders(200, 0);
			OutputStream out = exchange.getResponseBody();
			try {
				while (tokens.hasNext()) {
					out.write(tokens.next().text().getBytes(StandardCharsets.UTF_8));
					out.flush();
				}
			} catch (BackendGenerationException e) {
				LOGGER.log(System.Logger.Level.ERROR, "Streaming response truncated by backend failure", e);
				throw new TruncatedStreamException(e);
			} catch (IOException e) {
				LOGGER.log(System.Logger.Level.DEBUG, () -> "Client went away mid-stream: " + e.getMessage());
				return;
			}
			out.close();
		}
	}

	private static final class TruncatedStreamException extends IOException {
		private TruncatedStreamException(BackendGenerationException cause) {
			super("Streaming response truncated", cause);
		}
	}

	@Override
	public void close() {
		server.stop(0);
		executor.shutdown();
		try {
			if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
				executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}

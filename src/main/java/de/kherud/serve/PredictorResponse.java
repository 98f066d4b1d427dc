package de.kherud.serve;

import de.kherud.serve.stream.TokenStream;
import org.jetbrains.annotations.Nullable;

/**
 * Transport-neutral response of a deployment call: a JSON body with a status, or a token stream that is sent with
 * status 200 as {@code text/plain}.
 */
public final class PredictorResponse {

	public static final String JSON = "application/json";
	public static final String TEXT = "text/plain";

	private final int status;
	private final Object body;
	private final TokenStream stream;

	private PredictorResponse(int status, Object body, TokenStream stream) {
		this.status = status;
		this.body = body;
		this.stream = stream;
	}

	public static PredictorResponse json(Object body) {
		return new PredictorResponse(200, body, null);
	}

	public static PredictorResponse error(int status, String message) {
		return new PredictorResponse(status, message, null);
	}

	public static PredictorResponse stream(TokenStream stream) {
		return new PredictorResponse(200, null, stream);
	}

	public int getStatus() {
		return status;
	}

	@Nullable
	public Object getBody() {
		return body;
	}

	@Nullable
	public TokenStream getStream() {
		return stream;
	}

	public boolean isStreaming() {
		return stream != null;
	}

	public String getMediaType() {
		return isStreaming() ? TEXT : JSON;
	}

	@Override
	public String toString() {
		return "PredictorResponse{status=" + status + (isStreaming() ? ", streaming" : ", body=" + body) + '}';
	}
}

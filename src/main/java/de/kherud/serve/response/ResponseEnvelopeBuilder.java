package de.kherud.serve.response;

import de.kherud.serve.backend.GenerationResult;
import de.kherud.serve.stream.StreamToken;
import de.kherud.serve.stream.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntSupplier;

/**
 * Wraps backend output into {@link ResponseEnvelope}s. Preprocessing time is not measured and always reported as 0.
 */
public final class ResponseEnvelopeBuilder {

	private ResponseEnvelopeBuilder() {
	}

	public static ResponseEnvelope fromResult(GenerationResult result) {
		return new ResponseEnvelope(result.text(), result.inputLength(), result.inputLength(),
			result.generateLength(), 0);
	}

	public static List<ResponseEnvelope> fromResults(List<GenerationResult> results) {
		List<ResponseEnvelope> envelopes = new ArrayList<>(results.size());
		results.forEach(result -> envelopes.add(fromResult(result)));
		return envelopes;
	}

	public static ResponseEnvelope fromToken(String text, int inputLength) {
		return new ResponseEnvelope(text, inputLength, inputLength, 1, 0);
	}

	/**
	 * One envelope per token. The input length comes from the token itself; {@code inputLengthProbe} is only asked
	 * while neither the token nor an earlier probe answer knows it. The first known value is cached.
	 */
	public static EnvelopeStream stream(TokenStream tokens, IntSupplier inputLengthProbe) {
		return new TokenEnvelopeStream(tokens, inputLengthProbe);
	}

	private static final class TokenEnvelopeStream implements EnvelopeStream {
		private final TokenStream tokens;
		private final IntSupplier inputLengthProbe;
		private int inputLength;

		private TokenEnvelopeStream(TokenStream tokens, IntSupplier inputLengthProbe) {
			this.tokens = tokens;
			this.inputLengthProbe = inputLengthProbe;
		}

		@Override
		public boolean hasNext() {
			return tokens.hasNext();
		}

		@Override
		public ResponseEnvelope next() {
			StreamToken token = tokens.next();
			if (token.inputLength() > 0) {
				inputLength = token.inputLength();
			} else if (inputLength <= 0) {
				inputLength = Math.max(0, inputLengthProbe.getAsInt());
			}
			return fromToken(token.text(), inputLength);
		}

		@Override
		public void close() {
			tokens.close();
		}
	}
}

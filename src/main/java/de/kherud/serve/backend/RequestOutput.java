package de.kherud.serve.backend;

/**
 * Progress snapshot published by an asynchronous streaming backend. {@code text} is cumulative: each
 * snapshot contains everything generated so far for the request.
 */
public record RequestOutput(String text, int promptTokens, int generatedTokens, boolean finished) {
}

package de.kherud.serve.backend;

/**
 * Whole-prompt generation output.
 *
 * @param text generated text
 * @param inputLength prompt token count
 * @param generateLength generated token count
 */
public record GenerationResult(String text, int inputLength, int generateLength) {
}

package de.kherud.serve.stream;

/**
 * One incremental unit of generated text.
 *
 * @param text the newly generated fragment
 * @param inputLength prompt token count as far as it is known, {@code 0} while unknown
 * @param generatedCount number of tokens emitted so far, this one included
 */
public record StreamToken(String text, int inputLength, int generatedCount) {
}

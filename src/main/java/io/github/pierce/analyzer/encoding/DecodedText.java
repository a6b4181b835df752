package io.github.pierce.analyzer.encoding;

/**
 * Text decoded from a raw file, with the canonical name of the charset that decoded it.
 */
public record DecodedText(String text, String encoding) {
}

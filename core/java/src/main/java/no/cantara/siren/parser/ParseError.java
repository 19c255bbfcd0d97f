package no.cantara.siren.parser;

/**
 * A syntax error.
 *
 * @param line     1-based
 * @param column   1-based
 * @param found    the offending source text, empty at end of input
 * @param document document name, or {@code null}
 */
public record ParseError(
        String message,
        int line,
        int column,
        String found,
        String document
) {
}

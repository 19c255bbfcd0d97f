package no.cantara.siren.parser;

/**
 * Turns Siren source text into a CST. Implementations are fully initialised when
 * constructed and safe to call from several threads.
 */
public interface SirenParserAdapter {

    /**
     * @param document name recorded on every origin and error, or {@code null}
     */
    ParseResult parse(String source, String document);

    default ParseResult parse(String source) {
        return parse(source, null);
    }
}

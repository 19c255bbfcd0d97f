package no.cantara.siren.cst;

/**
 * A bare or quoted identifier. {@code value} has the quotes stripped, {@code text}
 * is exactly what the source contains.
 */
public record IdentifierNode(
        String text,
        String value,
        boolean quoted,
        Origin origin
) {
    public static IdentifierNode bare(String name) {
        return new IdentifierNode(name, name, false, null);
    }
}

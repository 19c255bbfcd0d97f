package no.cantara.siren.cst;

/**
 * {@code key = value} inside a resource body.
 */
public record AttributeNode(
        IdentifierNode key,
        ExpressionNode value,
        Origin origin
) {
}
